package com.priceintel.backend.controller;

import com.priceintel.backend.exception.AnalysisUnavailableException;
import com.priceintel.backend.exception.JobNotFoundException;
import com.priceintel.backend.exception.LedgerWriteFailedException;
import com.priceintel.backend.exception.QuotaExceededException;
import com.priceintel.backend.exception.UploadFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps domain exceptions to {@code {status, reason, message, ts}} error bodies.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException ex) {
        return error(HttpStatus.BAD_REQUEST, "bad_request",
                ex.getMessage() == null ? "invalid_request" : ex.getMessage());
    }

    @ExceptionHandler({ MissingServletRequestParameterException.class, MissingServletRequestPartException.class })
    public ResponseEntity<Map<String, Object>> missingInput(Exception ex) {
        return error(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> validation(MethodArgumentNotValidException ex) {
        Map<String, String> fields = new HashMap<>();
        for (FieldError fe : ex.getBindingResult().getFieldErrors()) {
            fields.put(fe.getField(), fe.getDefaultMessage() == null ? "invalid" : fe.getDefaultMessage());
        }
        Map<String, Object> body = body("validation_error", "invalid_request");
        body.put("fields", fields);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler(QuotaExceededException.class)
    public ResponseEntity<Map<String, Object>> quotaExceeded(QuotaExceededException ex) {
        return error(HttpStatus.PAYMENT_REQUIRED, "quota_exceeded", ex.getMessage());
    }

    @ExceptionHandler(UploadFailedException.class)
    public ResponseEntity<Map<String, Object>> uploadFailed(UploadFailedException ex) {
        return error(HttpStatus.BAD_GATEWAY, "upload_failed", "Image upload failed, please resubmit");
    }

    @ExceptionHandler(AnalysisUnavailableException.class)
    public ResponseEntity<Map<String, Object>> analysisUnavailable(AnalysisUnavailableException ex) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, "analysis_unavailable", ex.getMessage());
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<Map<String, Object>> notFound(JobNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, "not_found", ex.getMessage());
    }

    @ExceptionHandler(LedgerWriteFailedException.class)
    public ResponseEntity<Map<String, Object>> ledgerWriteFailed(LedgerWriteFailedException ex) {
        log.error("[API] Ledger write failed", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "ledger_write_failed", ex.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String reason, String message) {
        return ResponseEntity.status(status).body(body(reason, message));
    }

    private static Map<String, Object> body(String reason, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "error");
        body.put("reason", reason);
        body.put("message", message);
        body.put("ts", Instant.now().toString());
        return body;
    }
}
