package com.flagship.general_ledger.sequence;

import lombok.Value;

import java.util.UUID;

/**
 * A voucher type or document type together with its numbering counter.
 */
@Value
public class NumberingType {
    UUID id;
    String code;
    String name;
    long lastNumber;
    int padding;
    boolean active;

    /**
     * Formats a counter value as {@code CODE-000042}, left-padding the counter to {@link #padding} digits.
     */
    public String format(long number) {
        return format(code, number, padding);
    }

    /**
     * True when the number has this type's {@code CODE-<digits>} shape, i.e. it belongs to the allocated series.
     */
    public boolean isInSeries(String number) {
        if (number == null) {
            return false;
        }
        String prefix = code + "-";
        if (number.length() <= prefix.length() || !number.regionMatches(true, 0, prefix, 0, prefix.length())) {
            return false;
        }
        return number.substring(prefix.length()).chars().allMatch(Character::isDigit);
    }

    public static String format(String code, long number, int padding) {
        if (number <= 0) {
            throw new IllegalArgumentException("Sequence numbers start at 1, got " + number);
        }
        String digits = Long.toString(number);
        String padded = digits.length() >= padding
            ? digits
            : "0".repeat(padding - digits.length()) + digits;
        return code + "-" + padded;
    }
}
