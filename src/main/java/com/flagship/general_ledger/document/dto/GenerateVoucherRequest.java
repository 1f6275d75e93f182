package com.flagship.general_ledger.document.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.UUID;

@Value
@Builder
@Jacksonized
public class GenerateVoucherRequest {

    @NotNull(message = "Voucher type is required")
    @JsonProperty("voucher_type_id")
    UUID voucherTypeId;
}
