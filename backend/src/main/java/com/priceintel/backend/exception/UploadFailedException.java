package com.priceintel.backend.exception;

public class UploadFailedException extends RuntimeException {

    public UploadFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
