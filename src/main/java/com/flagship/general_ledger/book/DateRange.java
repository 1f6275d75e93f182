package com.flagship.general_ledger.book;

import com.flagship.general_ledger.exception.ValidationException;
import lombok.Value;

import java.time.LocalDate;

/**
 * Inclusive date range. Either bound may be open (null).
 */
@Value
public class DateRange {
    LocalDate from;
    LocalDate to;

    /**
     * @throws ValidationException if from is after to
     */
    public static DateRange of(LocalDate from, LocalDate to) {
        if (from != null && to != null && from.isAfter(to)) {
            throw new ValidationException("Date range start " + from + " is after its end " + to);
        }
        return new DateRange(from, to);
    }

    public static DateRange unbounded() {
        return new DateRange(null, null);
    }

    public boolean contains(LocalDate date) {
        return (from == null || !date.isBefore(from)) && (to == null || !date.isAfter(to));
    }
}
