package com.flagship.general_ledger.journal.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Fact published for downstream consumers (report renderers, bank integration).
 * Written to the outbox in the same transaction as the change it describes.
 */
public interface LedgerEvent {

    /**
     * Unique per event instance, for consumer deduplication.
     */
    UUID getEventId();

    /**
     * Entry or document the event is about. Used as the Kafka key.
     */
    UUID getAggregateId();

    Instant getOccurredAt();

    String getEventType();
}
