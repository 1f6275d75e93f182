package com.flagship.general_ledger.period;

import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Bounded accounting period. Entries may be posted only into open periods
 * whose range contains the entry date.
 */
@Value
public class FiscalPeriod {
    UUID id;
    String name;
    LocalDate startDate;
    LocalDate endDate;
    boolean closed;

    public boolean contains(LocalDate date) {
        return !date.isBefore(startDate) && !date.isAfter(endDate);
    }

    public boolean isOpen() {
        return !closed;
    }

    public boolean acceptsPostingOn(LocalDate date) {
        return isOpen() && contains(date);
    }
}
