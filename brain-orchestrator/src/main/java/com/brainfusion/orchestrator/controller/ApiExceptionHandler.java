package com.brainfusion.orchestrator.controller;

import com.brainfusion.common.exception.KnowledgeNotFoundException;
import com.brainfusion.common.exception.RequestNotFoundException;
import com.brainfusion.common.exception.ValidationRejectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Maps domain exceptions to HTTP statuses with a small JSON error body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({RequestNotFoundException.class, KnowledgeNotFoundException.class,
                       NoSuchElementException.class})
    public ResponseEntity<Map<String, Object>> notFound(RuntimeException e) {
        log.warn("[Api] Not found. reason={}", e.getMessage());
        return body(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException e) {
        log.warn("[Api] Bad request. reason={}", e.getMessage());
        return body(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(ValidationRejectedException.class)
    public ResponseEntity<Map<String, Object>> rejected(ValidationRejectedException e) {
        log.warn("[Api] Update rejected. updateId={} reason={}", e.getUpdateId(), e.getMessage());
        return body(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("message", message == null ? "" : message);
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.status(status).body(body);
    }
}
