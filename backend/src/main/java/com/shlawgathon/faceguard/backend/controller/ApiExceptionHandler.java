package com.shlawgathon.faceguard.backend.controller;

import com.shlawgathon.faceguard.backend.client.RecordNotFoundException;
import com.shlawgathon.faceguard.backend.client.RecordStoreException;
import com.shlawgathon.faceguard.backend.client.UpstreamUnavailableException;
import com.shlawgathon.faceguard.backend.dto.ErrorResponse;
import com.shlawgathon.faceguard.backend.index.CorruptIndexException;
import com.shlawgathon.faceguard.backend.index.DimensionMismatchException;
import com.shlawgathon.faceguard.backend.index.InvalidVectorException;
import com.shlawgathon.faceguard.backend.service.AlertInstanceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps exceptions to {@link ErrorResponse} bodies.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        Map<String, String> fields = new LinkedHashMap<>();
        e.getBindingResult().getFieldErrors()
                .forEach(error -> fields.putIfAbsent(error.getField(), error.getDefaultMessage()));
        return error(HttpStatus.BAD_REQUEST, "validation_error", "Request validation failed", fields);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception e) {
        return error(HttpStatus.BAD_REQUEST, "validation_error", "Malformed request", null);
    }

    @ExceptionHandler(DimensionMismatchException.class)
    public ResponseEntity<ErrorResponse> handleDimension(DimensionMismatchException e) {
        return error(HttpStatus.BAD_REQUEST, "dimension_mismatch", e.getMessage(), null);
    }

    @ExceptionHandler(InvalidVectorException.class)
    public ResponseEntity<ErrorResponse> handleInvalidVector(InvalidVectorException e) {
        return error(HttpStatus.BAD_REQUEST, "validation_error", e.getMessage(),
                Map.of("component", e.getComponent()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, "invalid_argument", e.getMessage(), null);
    }

    @ExceptionHandler(RecordNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleRecordNotFound(RecordNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, "not_found", e.getMessage(), e.getPayload());
    }

    @ExceptionHandler(AlertInstanceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleAlertNotFound(AlertInstanceNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, "not_found", e.getMessage(), null);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException e) {
        return error(HttpStatus.CONFLICT, "invalid_state", e.getMessage(), null);
    }

    @ExceptionHandler(RecordStoreException.class)
    public ResponseEntity<ErrorResponse> handleRecordStore(RecordStoreException e) {
        log.warn("[RECORD STORE] Upstream error {}: {}", e.getStatusCode(), e.getMessage());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("upstream_status", e.getStatusCode());
        details.put("upstream_payload", e.getPayload());
        return error(HttpStatus.BAD_GATEWAY, "upstream_error", e.getMessage(), details);
    }

    @ExceptionHandler(UpstreamUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleUnavailable(UpstreamUnavailableException e) {
        log.warn("[RECORD STORE] Unavailable: {}", e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "upstream_unavailable", e.getMessage(), null);
    }

    @ExceptionHandler(CorruptIndexException.class)
    public ResponseEntity<ErrorResponse> handleCorruptIndex(CorruptIndexException e) {
        log.error("[INDEX] Corrupt index surfaced to a caller: {}", e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "corrupt_index", e.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("Unhandled error", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Internal server error", null);
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String kind, String message, Object details) {
        return ResponseEntity.status(status).body(ErrorResponse.builder()
                .errorKind(kind)
                .message(message)
                .details(details)
                .build());
    }
}
