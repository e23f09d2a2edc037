package com.commandcenter.layout_service.controller;

import com.commandcenter.layout_service.engine.LayoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(LayoutException.class)
    public ResponseEntity<Map<String, String>> handleLayout(LayoutException ex) {
        log.warn("Layout request rejected: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", ex.getMessage()));
    }

    // Malformed JSON or a body whose fields have the wrong types
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadable(HttpMessageNotReadableException ex) {
        String msg = ex.getMostSpecificCause().getMessage() != null
                ? ex.getMostSpecificCause().getMessage()
                : ex.getClass().getSimpleName();
        log.warn("Unreadable layout request: {}", msg);
        return ResponseEntity.badRequest().body(Map.of("error", "Malformed request body: " + msg));
    }
}
