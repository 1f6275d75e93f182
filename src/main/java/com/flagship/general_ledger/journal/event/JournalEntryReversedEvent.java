package com.flagship.general_ledger.journal.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flagship.general_ledger.journal.JournalEntry;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A posted entry was offset by a mirrored reversing entry.
 * Both stay in the books; together they net to zero.
 */
@Value
public class JournalEntryReversedEvent implements LedgerEvent {
    UUID eventId;
    UUID entryId;
    String entryNumber;
    UUID reversalEntryId;
    String reversalEntryNumber;
    LocalDate reversalDate;
    String reason;
    String reversedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "JournalEntryReversed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    @JsonIgnore
    public UUID getAggregateId() {
        return entryId;
    }

    public static JournalEntryReversedEvent of(JournalEntry original, JournalEntry reversal,
                                               String reason, String actorId) {
        return new JournalEntryReversedEvent(
            UUID.randomUUID(),
            original.getId(),
            original.getEntryNumber(),
            reversal.getId(),
            reversal.getEntryNumber(),
            reversal.getDate(),
            reason,
            actorId,
            Instant.now()
        );
    }
}
