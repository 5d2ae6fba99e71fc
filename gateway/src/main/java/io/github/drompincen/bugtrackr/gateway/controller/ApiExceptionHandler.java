package io.github.drompincen.bugtrackr.gateway.controller;

import io.github.drompincen.bugtrackr.protocol.error.ConsistencyFatalException;
import io.github.drompincen.bugtrackr.protocol.error.DenialReason;
import io.github.drompincen.bugtrackr.protocol.error.MalformedDataException;
import io.github.drompincen.bugtrackr.protocol.error.NotFoundException;
import io.github.drompincen.bugtrackr.protocol.error.RemoteStoreException;
import io.github.drompincen.bugtrackr.protocol.error.TransitionDeniedException;
import io.github.drompincen.bugtrackr.protocol.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;

/**
 * Maps the failure taxonomy to HTTP. Store-side details (status codes, URLs, item
 * payloads) stay in the log; clients get a generic message for them.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(ValidationException ex) {
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        if (ex.getMostSpecificCause() instanceof ValidationException invalid) {
            return error(HttpStatus.BAD_REQUEST, invalid.getMessage());
        }
        return error(HttpStatus.BAD_REQUEST, "Malformed request body");
    }

    @ExceptionHandler(TransitionDeniedException.class)
    public ResponseEntity<Map<String, Object>> handleDenied(TransitionDeniedException ex) {
        HttpStatus status = ex.getReason() == DenialReason.PRECONDITION_NOT_MET
                ? HttpStatus.BAD_REQUEST : HttpStatus.FORBIDDEN;
        return error(status, ex.getMessage());
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(NotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(RemoteStoreException.class)
    public ResponseEntity<Map<String, Object>> handleRemote(RemoteStoreException ex) {
        log.error("Document store {} failed: {}", ex.getOperation(), ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "Service temporarily unavailable");
    }

    @ExceptionHandler(MalformedDataException.class)
    public ResponseEntity<Map<String, Object>> handleMalformed(MalformedDataException ex) {
        log.error("Unreadable stored item '{}': {}", ex.getItemId(), ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "Service temporarily unavailable");
    }

    @ExceptionHandler(ConsistencyFatalException.class)
    public ResponseEntity<Map<String, Object>> handleFatal(ConsistencyFatalException ex) {
        log.error("CRITICAL: {} (operation={}, collection={}, id={})",
                ex.getMessage(), ex.getOperation(), ex.getCollection(), ex.getItemId(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Operation failed and could not be rolled back");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnhandled(Exception ex) {
        log.error("Unhandled exception", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status)
                .body(Map.of("error", message != null ? message : status.getReasonPhrase(),
                        "timestamp", Instant.now().toString()));
    }
}
