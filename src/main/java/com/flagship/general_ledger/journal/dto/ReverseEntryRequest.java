package com.flagship.general_ledger.journal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

/**
 * Body of a reversal. Both fields are optional; without a date the mirror keeps the original's date.
 */
@Value
@Builder
@Jacksonized
public class ReverseEntryRequest {

    @JsonProperty("date")
    LocalDate date;

    @Size(max = 500, message = "Reason is at most 500 characters")
    @JsonProperty("reason")
    String reason;
}
