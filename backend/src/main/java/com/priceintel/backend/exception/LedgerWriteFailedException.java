package com.priceintel.backend.exception;

/**
 * A balance-affecting event could not be recorded. Always propagated.
 */
public class LedgerWriteFailedException extends RuntimeException {

    public LedgerWriteFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
