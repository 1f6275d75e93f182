package com.flagship.general_ledger.document;

/**
 * DRAFT --approve--> APPROVED --cancel--> CANCELLED, and DRAFT --cancel--> CANCELLED.
 * Vouchers are generated only from APPROVED documents.
 */
public enum DocumentStatus {
    DRAFT,
    APPROVED,
    CANCELLED;

    public boolean canTransitionTo(DocumentStatus target) {
        return switch (this) {
            case DRAFT -> target == APPROVED || target == CANCELLED;
            case APPROVED -> target == CANCELLED;
            case CANCELLED -> false;
        };
    }
}
