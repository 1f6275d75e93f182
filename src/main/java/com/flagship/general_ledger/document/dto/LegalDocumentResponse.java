package com.flagship.general_ledger.document.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.general_ledger.document.DocumentStatus;
import com.flagship.general_ledger.document.LegalDocument;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class LegalDocumentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("document_type_id")
    UUID documentTypeId;

    @JsonProperty("document_number")
    String documentNumber;

    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("reference")
    String reference;

    @JsonProperty("description")
    String description;

    @JsonProperty("third_party_id")
    UUID thirdPartyId;

    @JsonProperty("status")
    DocumentStatus status;

    @JsonProperty("subtotal")
    BigDecimal subtotal;

    @JsonProperty("tax_amount")
    BigDecimal taxAmount;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("exchange_rate")
    BigDecimal exchangeRate;

    @JsonProperty("fiscal_period_id")
    UUID fiscalPeriodId;

    @JsonProperty("approved_by")
    String approvedBy;

    @JsonProperty("approved_at")
    Instant approvedAt;

    @JsonProperty("cancellation_reason")
    String cancellationReason;

    @JsonProperty("cancelled_by")
    String cancelledBy;

    @JsonProperty("cancelled_at")
    Instant cancelledAt;

    @JsonProperty("created_by")
    String createdBy;

    @JsonProperty("created_at")
    Instant createdAt;

    public static LegalDocumentResponse from(LegalDocument document) {
        return LegalDocumentResponse.builder()
            .id(document.getId())
            .documentTypeId(document.getDocumentTypeId())
            .documentNumber(document.getDocumentNumber())
            .date(document.getDate())
            .reference(document.getReference())
            .description(document.getDescription())
            .thirdPartyId(document.getThirdPartyId())
            .status(document.getStatus())
            .subtotal(document.getSubtotal())
            .taxAmount(document.getTaxAmount())
            .totalAmount(document.getTotalAmount())
            .currency(document.getCurrency())
            .exchangeRate(document.getExchangeRate())
            .fiscalPeriodId(document.getFiscalPeriodId())
            .approvedBy(document.getApprovedBy())
            .approvedAt(document.getApprovedAt())
            .cancellationReason(document.getCancellationReason())
            .cancelledBy(document.getCancelledBy())
            .cancelledAt(document.getCancelledAt())
            .createdBy(document.getCreatedBy())
            .createdAt(document.getCreatedAt())
            .build();
    }
}
