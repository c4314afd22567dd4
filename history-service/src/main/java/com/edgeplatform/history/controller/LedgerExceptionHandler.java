package com.edgeplatform.history.controller;

import com.edgeplatform.common.exception.EdgeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class LedgerExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(LedgerExceptionHandler.class);

    @ExceptionHandler(EdgeException.class)
    public ResponseEntity<Map<String, String>> handleEdge(EdgeException e) {
        log.warn("Request rejected. component={} message={}", e.getComponent(), e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(Map.of("component", e.getComponent(), "error", e.getMessage()));
    }
}
