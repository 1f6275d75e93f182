package com.flagship.general_ledger.journal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.general_ledger.journal.Reversal;
import lombok.Value;

@Value
public class ReversalResponse {

    @JsonProperty("original")
    JournalEntryResponse original;

    @JsonProperty("reversal")
    JournalEntryResponse reversal;

    public static ReversalResponse from(Reversal reversal) {
        return new ReversalResponse(
            JournalEntryResponse.from(reversal.getOriginal()),
            JournalEntryResponse.from(reversal.getReversal()));
    }
}
