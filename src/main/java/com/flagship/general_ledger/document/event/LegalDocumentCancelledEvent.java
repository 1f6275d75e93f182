package com.flagship.general_ledger.document.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flagship.general_ledger.document.LegalDocument;
import com.flagship.general_ledger.journal.event.LedgerEvent;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A document was cancelled; its draft vouchers were cancelled with it.
 */
@Value
public class LegalDocumentCancelledEvent implements LedgerEvent {
    UUID eventId;
    UUID documentId;
    UUID documentTypeId;
    String documentNumber;
    String reason;
    String cancelledBy;
    List<UUID> cancelledEntryIds;
    Instant occurredAt;

    public static final String EVENT_TYPE = "LegalDocumentCancelled";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    @JsonIgnore
    public UUID getAggregateId() {
        return documentId;
    }

    public static LegalDocumentCancelledEvent of(LegalDocument document, List<UUID> cancelledEntryIds) {
        return new LegalDocumentCancelledEvent(
            UUID.randomUUID(),
            document.getId(),
            document.getDocumentTypeId(),
            document.getDocumentNumber(),
            document.getCancellationReason(),
            document.getCancelledBy(),
            List.copyOf(cancelledEntryIds),
            Instant.now()
        );
    }
}
