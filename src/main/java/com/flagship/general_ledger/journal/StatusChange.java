package com.flagship.general_ledger.journal;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Row of the entry status history. previousStatus is null for the creation row;
 * newStatus is "DELETED" for a removed draft.
 */
@Value
public class StatusChange {
    UUID entryId;
    String entryNumber;
    String previousStatus;
    String newStatus;
    String actorId;
    String comments;
    Instant changedAt;
}
