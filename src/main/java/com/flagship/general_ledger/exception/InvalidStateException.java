package com.flagship.general_ledger.exception;

/**
 * The operation is not allowed from the current status of an entry or document.
 * Usually means the caller acted on a stale view.
 */
public class InvalidStateException extends IllegalStateException {

    public InvalidStateException(String message) {
        super(message);
    }
}
