package com.flagship.general_ledger.journal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.general_ledger.journal.StatusChange;
import lombok.Value;

import java.time.Instant;

@Value
public class StatusChangeResponse {

    @JsonProperty("previous_status")
    String previousStatus;

    @JsonProperty("new_status")
    String newStatus;

    @JsonProperty("actor_id")
    String actorId;

    @JsonProperty("comments")
    String comments;

    @JsonProperty("changed_at")
    Instant changedAt;

    public static StatusChangeResponse from(StatusChange change) {
        return new StatusChangeResponse(change.getPreviousStatus(), change.getNewStatus(),
            change.getActorId(), change.getComments(), change.getChangedAt());
    }
}
