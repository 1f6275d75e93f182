package com.flagship.general_ledger.exception;

import java.util.Map;

/**
 * The operation collides with existing ledger data, e.g. a second voucher for the
 * same document, or cancelling a document whose voucher is already posted.
 *
 * {@link #getDetails()} names what blocks the operation.
 */
public class ConflictException extends RuntimeException {

    private final Map<String, String> details;

    public ConflictException(String message) {
        this(message, Map.of());
    }

    public ConflictException(String message, Map<String, String> details) {
        super(message);
        this.details = Map.copyOf(details);
    }

    public Map<String, String> getDetails() {
        return details;
    }
}
