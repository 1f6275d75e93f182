package com.flagship.general_ledger.book.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.general_ledger.book.JournalBookPage;
import com.flagship.general_ledger.journal.dto.JournalEntryResponse;
import lombok.Value;

import java.util.List;

@Value
public class JournalBookResponse {

    @JsonProperty("entries")
    List<JournalEntryResponse> entries;

    @JsonProperty("page")
    int page;

    @JsonProperty("size")
    int size;

    @JsonProperty("total_elements")
    long totalElements;

    @JsonProperty("total_pages")
    int totalPages;

    public static JournalBookResponse from(JournalBookPage page) {
        return new JournalBookResponse(
            page.getEntries().stream().map(JournalEntryResponse::from).toList(),
            page.getPage(),
            page.getSize(),
            page.getTotalElements(),
            page.getTotalPages());
    }
}
