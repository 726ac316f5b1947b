package com.priceintel.backend.exception;

/**
 * The inference call failed or returned an unusable payload. The message is stored on the job
 * as-is, so it must be readable.
 */
public class InferenceFailedException extends RuntimeException {

    public InferenceFailedException(String message) {
        super(message);
    }

    public InferenceFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
