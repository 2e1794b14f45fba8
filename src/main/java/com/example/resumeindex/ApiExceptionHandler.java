package com.example.resumeindex;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ResumeIndexException.class)
    public ResponseEntity<Map<String, Object>> handleIndexException(ResumeIndexException ex, HttpServletRequest request) {
        if (ex.getCause() != null) {
            log.error("[{}] {} - {} ({})", request.getMethod(), request.getRequestURI(), ex.getMessage(), ex.getErrorCode(), ex);
        } else {
            log.warn("[{}] {} - {} ({})", request.getMethod(), request.getRequestURI(), ex.getMessage(), ex.getErrorCode());
        }
        Map<String, Object> body = body(ex.getErrorCode().name(), ex.getMessage());
        if (ex instanceof DimensionMismatchException) {
            DimensionMismatchException dm = (DimensionMismatchException) ex;
            body.put("expected", dm.getExpected());
            body.put("actual", dm.getActual());
        }
        return ResponseEntity.status(ex.getErrorCode().status()).body(body);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        log.warn("[{}] {} - unreadable request body: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return ResponseEntity.badRequest().body(body(ErrorCode.CONFIGURATION.name(), "Request body is not readable JSON."));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("[{}] {} - unexpected failure", request.getMethod(), request.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body("INTERNAL", "Internal error: " + ex.getMessage()));
    }

    private static Map<String, Object> body(String code, String message) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("code", code);
        out.put("message", message);
        return out;
    }
}
