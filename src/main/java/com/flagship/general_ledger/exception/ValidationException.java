package com.flagship.general_ledger.exception;

import java.util.List;

/**
 * A request broke a ledger rule: unbalanced entry, empty or malformed lines,
 * non-postable account, closed period.
 *
 * Carries every violation found for the request so callers can fix them in one pass.
 */
public class ValidationException extends IllegalArgumentException {

    private final List<String> violations;

    public ValidationException(String message) {
        this(message, List.of(message));
    }

    public ValidationException(String message, List<String> violations) {
        super(message);
        this.violations = List.copyOf(violations);
    }

    public static ValidationException of(List<String> violations) {
        return new ValidationException(String.join("; ", violations), violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
