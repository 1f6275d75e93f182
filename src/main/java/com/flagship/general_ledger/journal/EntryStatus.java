package com.flagship.general_ledger.journal;

/**
 * Lifecycle of a journal entry.
 *
 * <pre>
 * DRAFT --post--> POSTED --reverse--> REVERSED
 * DRAFT --cancel (document cascade)--> CANCELLED
 * DRAFT --delete--> (removed)
 * </pre>
 *
 * Nothing re-enters DRAFT. Only DRAFT entries can be edited or deleted.
 */
public enum EntryStatus {
    /**
     * Editable; does not count toward any balance.
     */
    DRAFT,

    /**
     * Counts toward balances. Lines are frozen.
     */
    POSTED,

    /**
     * Was posted and has been offset by a mirrored reversing entry.
     * Still counts toward balances, netting to zero with its mirror.
     */
    REVERSED,

    /**
     * Cancelled before posting together with its source document. Never counted.
     */
    CANCELLED;

    public boolean canTransitionTo(EntryStatus target) {
        return switch (this) {
            case DRAFT -> target == POSTED || target == CANCELLED;
            case POSTED -> target == REVERSED;
            case REVERSED, CANCELLED -> false;
        };
    }

    /**
     * Statuses whose lines appear in the books and balances.
     */
    public boolean isLedgerEffective() {
        return this == POSTED || this == REVERSED;
    }

    public boolean isEditable() {
        return this == DRAFT;
    }
}
