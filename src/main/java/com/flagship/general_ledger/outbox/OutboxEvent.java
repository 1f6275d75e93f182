package com.flagship.general_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Ledger event waiting in (or already sent from) the transactional outbox.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // "JournalEntry" or "LegalDocument"
    UUID aggregateId;
    String eventType;          // e.g. "JournalEntryPosted"
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until Kafka acknowledged it
    int retryCount;
    String lastError;
    Long sequenceNumber;       // assigned by the database, defines publish order

    /**
     * The outbox row shares its id with the event it carries, so consumers can deduplicate on either.
     */
    public static OutboxEvent create(UUID eventId, String aggregateType, UUID aggregateId,
                                     String eventType, String payload) {
        return new OutboxEvent(
            eventId,
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
