package com.flagship.general_ledger.chart;

import lombok.Value;

import java.util.UUID;

/**
 * Account from the chart of accounts.
 * Owned by the chart; the ledger only reads it.
 */
@Value
public class Account {
    UUID id;
    String code;
    String name;
    NormalBalance normalBalance;
    boolean allowsEntries;
    boolean active;

    /**
     * Only active leaf accounts may receive journal lines.
     */
    public boolean isPostable() {
        return active && allowsEntries;
    }
}
