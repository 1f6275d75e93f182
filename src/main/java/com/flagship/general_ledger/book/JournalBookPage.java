package com.flagship.general_ledger.book;

import com.flagship.general_ledger.journal.JournalEntry;
import lombok.Value;

import java.util.List;

@Value
public class JournalBookPage {
    List<JournalEntry> entries;
    int page;
    int size;
    long totalElements;
    int totalPages;
}
