package com.answer.pipeline.controller;

import com.answer.pipeline.exception.NoUsableSourcesException;
import com.answer.pipeline.exception.PipelineTimeoutException;
import com.answer.pipeline.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> validation(ValidationException ex) {
        return body(HttpStatus.BAD_REQUEST, "validation_error", ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> unreadable(HttpMessageNotReadableException ex) {
        return body(HttpStatus.BAD_REQUEST, "bad_request", "malformed request body");
    }

    @ExceptionHandler(NoUsableSourcesException.class)
    public ResponseEntity<Map<String, Object>> noSources(NoUsableSourcesException ex) {
        return body(HttpStatus.SERVICE_UNAVAILABLE, "no_usable_sources", ex.getMessage());
    }

    @ExceptionHandler(PipelineTimeoutException.class)
    public ResponseEntity<Map<String, Object>> timeout(PipelineTimeoutException ex) {
        return body(HttpStatus.GATEWAY_TIMEOUT, "timeout", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> internal(Exception ex) {
        log.error("event=unhandled_error cause={}", ex.toString(), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error",
                ex.getMessage() == null ? "unexpected error" : ex.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(Map.of(
                "timestamp", Instant.now().toString(),
                "error", error,
                "message", message == null ? "" : message
        ));
    }
}
