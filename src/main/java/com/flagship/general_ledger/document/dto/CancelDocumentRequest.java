package com.flagship.general_ledger.document.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class CancelDocumentRequest {

    @NotBlank(message = "Cancellation reason is required")
    @Size(max = 500, message = "Reason is at most 500 characters")
    @JsonProperty("reason")
    String reason;
}
