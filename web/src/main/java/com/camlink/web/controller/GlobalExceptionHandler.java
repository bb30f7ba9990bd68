/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.camlink.web.controller;

import com.camlink.common.exception.CamLinkException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Maps exceptions from the REST endpoints to JSON error bodies:
 * {@code {"status", "error", "error_code", "message", "path", "timestamp"}}.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> badRequest(Exception ex, HttpServletRequest request) {
        log.warn("Bad request at {} {}: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, null, ex.getMessage(), request);
    }

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<Map<String, Object>> notFound(NoSuchElementException ex, HttpServletRequest request) {
        log.info("Not found at {} {}: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return body(HttpStatus.NOT_FOUND, null, ex.getMessage(), request);
    }

    @ExceptionHandler(CamLinkException.class)
    public ResponseEntity<Map<String, Object>> camLink(CamLinkException ex, HttpServletRequest request) {
        log.error("[{}] at {} {}: {}", ex.getErrorCode(), request.getMethod(), request.getRequestURI(),
                ex.getMessage(), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, ex.getErrorCode(), ex.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> unexpected(Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception at {} {}: {}", request.getMethod(), request.getRequestURI(),
                ex.getMessage(), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, null, ex.getMessage(), request);
    }

    private ResponseEntity<Map<String, Object>> body(HttpStatus status, String errorCode, String message,
                                                     HttpServletRequest request) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("status", status.value());
        m.put("error", status.getReasonPhrase());
        if (errorCode != null) m.put("error_code", errorCode);
        m.put("message", message != null ? message : "An unexpected error occurred");
        m.put("path", request.getRequestURI());
        m.put("timestamp", LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS")));
        return ResponseEntity.status(status).body(m);
    }
}
