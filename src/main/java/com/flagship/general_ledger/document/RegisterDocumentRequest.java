package com.flagship.general_ledger.document;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Header of a legal document (invoice, credit note, receipt) to register as DRAFT.
 * The total is always subtotal + tax.
 */
@Value
@Builder
@Jacksonized
public class RegisterDocumentRequest {

    @NotNull(message = "Document type is required")
    @JsonProperty("document_type_id")
    UUID documentTypeId;

    @NotNull(message = "Document date is required")
    @JsonProperty("date")
    LocalDate date;

    @Size(max = 100, message = "Reference is at most 100 characters")
    @JsonProperty("reference")
    String reference;

    @JsonProperty("description")
    String description;

    @JsonProperty("third_party_id")
    UUID thirdPartyId;

    @NotNull(message = "Subtotal is required")
    @DecimalMin(value = "0.00", message = "Subtotal cannot be negative")
    @JsonProperty("subtotal")
    BigDecimal subtotal;

    @DecimalMin(value = "0.00", message = "Tax amount cannot be negative")
    @JsonProperty("tax_amount")
    BigDecimal taxAmount;

    @NotBlank(message = "Currency is required")
    @Pattern(regexp = "^[A-Z]{3}$", message = "Currency must be a 3-letter ISO code")
    @JsonProperty("currency")
    String currency;

    @DecimalMin(value = "0.000001", message = "Exchange rate must be positive")
    @JsonProperty("exchange_rate")
    BigDecimal exchangeRate;

    @NotNull(message = "Fiscal period is required")
    @JsonProperty("fiscal_period_id")
    UUID fiscalPeriodId;

    public BigDecimal taxOrZero() {
        return taxAmount != null ? taxAmount : BigDecimal.ZERO;
    }
}
