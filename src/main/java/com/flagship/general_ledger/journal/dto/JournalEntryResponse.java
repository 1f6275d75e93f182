package com.flagship.general_ledger.journal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.general_ledger.journal.EntryStatus;
import com.flagship.general_ledger.journal.JournalEntry;
import com.flagship.general_ledger.journal.JournalLine;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Journal entry with its lines, as returned by the API and the journal book.
 */
@Value
@Builder
public class JournalEntryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("entry_number")
    String entryNumber;

    @JsonProperty("voucher_type_id")
    UUID voucherTypeId;

    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("reference")
    String reference;

    @JsonProperty("description")
    String description;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("exchange_rate")
    BigDecimal exchangeRate;

    @JsonProperty("fiscal_period_id")
    UUID fiscalPeriodId;

    @JsonProperty("third_party_id")
    UUID thirdPartyId;

    @JsonProperty("status")
    EntryStatus status;

    @JsonProperty("total_debit")
    BigDecimal totalDebit;

    @JsonProperty("total_credit")
    BigDecimal totalCredit;

    @JsonProperty("document_type_id")
    UUID documentTypeId;

    @JsonProperty("document_id")
    UUID documentId;

    @JsonProperty("reversal_of_id")
    UUID reversalOfId;

    @JsonProperty("reversed_by_id")
    UUID reversedById;

    @JsonProperty("cancellation_reason")
    String cancellationReason;

    @JsonProperty("created_by")
    String createdBy;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("posted_by")
    String postedBy;

    @JsonProperty("posted_at")
    Instant postedAt;

    @JsonProperty("lines")
    List<LineResponse> lines;

    public static JournalEntryResponse from(JournalEntry entry) {
        return JournalEntryResponse.builder()
            .id(entry.getId())
            .entryNumber(entry.getEntryNumber())
            .voucherTypeId(entry.getVoucherTypeId())
            .date(entry.getDate())
            .reference(entry.getReference())
            .description(entry.getDescription())
            .currency(entry.getCurrency())
            .exchangeRate(entry.getExchangeRate())
            .fiscalPeriodId(entry.getFiscalPeriodId())
            .thirdPartyId(entry.getThirdPartyId())
            .status(entry.getStatus())
            .totalDebit(entry.getTotalDebit())
            .totalCredit(entry.getTotalCredit())
            .documentTypeId(entry.getDocumentTypeId())
            .documentId(entry.getDocumentId())
            .reversalOfId(entry.getReversalOfId())
            .reversedById(entry.getReversedById())
            .cancellationReason(entry.getCancellationReason())
            .createdBy(entry.getCreatedBy())
            .createdAt(entry.getCreatedAt())
            .postedBy(entry.getPostedBy())
            .postedAt(entry.getPostedAt())
            .lines(entry.getLines().stream().map(LineResponse::from).toList())
            .build();
    }

    @Value
    public static class LineResponse {

        @JsonProperty("id")
        UUID id;

        @JsonProperty("order_number")
        int orderNumber;

        @JsonProperty("account_id")
        UUID accountId;

        @JsonProperty("description")
        String description;

        @JsonProperty("debit_amount")
        BigDecimal debitAmount;

        @JsonProperty("credit_amount")
        BigDecimal creditAmount;

        @JsonProperty("third_party_id")
        UUID thirdPartyId;

        static LineResponse from(JournalLine line) {
            return new LineResponse(line.getId(), line.getOrderNumber(), line.getAccountId(),
                line.getDescription(), line.getDebitAmount(), line.getCreditAmount(), line.getThirdPartyId());
        }
    }
}
