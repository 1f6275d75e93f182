package com.flagship.general_ledger.document.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.general_ledger.document.DocumentCancellation;
import com.flagship.general_ledger.journal.dto.JournalEntryResponse;
import lombok.Value;

import java.util.List;

@Value
public class DocumentCancellationResponse {

    @JsonProperty("document")
    LegalDocumentResponse document;

    @JsonProperty("cancelled_entries")
    List<JournalEntryResponse> cancelledEntries;

    public static DocumentCancellationResponse from(DocumentCancellation cancellation) {
        return new DocumentCancellationResponse(
            LegalDocumentResponse.from(cancellation.getDocument()),
            cancellation.getCancelledEntries().stream().map(JournalEntryResponse::from).toList());
    }
}
