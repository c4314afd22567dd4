package com.edgeplatform.analysis.controller;

import com.edgeplatform.common.exception.EdgeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/** Maps pipeline input errors to 400 with a small JSON body. */
@RestControllerAdvice
public class EdgeExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(EdgeExceptionHandler.class);

    @ExceptionHandler(EdgeException.class)
    public ResponseEntity<Map<String, String>> handleEdge(EdgeException e) {
        log.warn("[Api] Request rejected. component={} message={}", e.getComponent(), e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(Map.of("component", e.getComponent(), "error", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("[Api] Invalid input. message={}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(Map.of("error", String.valueOf(e.getMessage())));
    }
}
