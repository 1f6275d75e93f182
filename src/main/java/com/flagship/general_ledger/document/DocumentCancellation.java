package com.flagship.general_ledger.document;

import com.flagship.general_ledger.journal.JournalEntry;
import lombok.Value;

import java.util.List;

/**
 * Result of cancelling a document: the cancelled document and the draft entries cancelled with it.
 */
@Value
public class DocumentCancellation {
    LegalDocument document;
    List<JournalEntry> cancelledEntries;
}
