package com.flagship.general_ledger.journal.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flagship.general_ledger.journal.JournalEntry;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * An entry became ledger-effective.
 */
@Value
public class JournalEntryPostedEvent implements LedgerEvent {
    UUID eventId;
    UUID entryId;
    String entryNumber;
    UUID voucherTypeId;
    LocalDate date;
    UUID fiscalPeriodId;
    String currency;
    BigDecimal totalDebit;
    BigDecimal totalCredit;
    UUID reversalOfId;
    UUID documentId;
    String postedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "JournalEntryPosted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    @JsonIgnore
    public UUID getAggregateId() {
        return entryId;
    }

    public static JournalEntryPostedEvent fromEntry(JournalEntry entry) {
        return new JournalEntryPostedEvent(
            UUID.randomUUID(),
            entry.getId(),
            entry.getEntryNumber(),
            entry.getVoucherTypeId(),
            entry.getDate(),
            entry.getFiscalPeriodId(),
            entry.getCurrency(),
            entry.getTotalDebit(),
            entry.getTotalCredit(),
            entry.getReversalOfId(),
            entry.getDocumentId(),
            entry.getPostedBy(),
            Instant.now()
        );
    }
}
