package com.priceintel.backend.exception;

/**
 * The owner has neither credits nor remaining tier allowance.
 */
public class QuotaExceededException extends RuntimeException {

    private final String ownerId;

    public QuotaExceededException(String ownerId) {
        super("Insufficient credits or subscription limit reached");
        this.ownerId = ownerId;
    }

    public String getOwnerId() {
        return ownerId;
    }
}
