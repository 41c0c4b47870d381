package com.insightreport.generator.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 보고서 API 전역 예외 핸들러
 */
@RestControllerAdvice(basePackages = "com.insightreport.generator.controller")
@Slf4j
public class ReportExceptionHandler {

    @ExceptionHandler(ReportValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(ReportValidationException ex) {
        log.warn("Validation error: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getErrorCode(), ex.getMessage(), ex.getReportId());
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> handleBind(WebExchangeBindException ex) {
        String message = ex.getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("Request validation failed: {}", message);
        return respond(HttpStatus.BAD_REQUEST, ReportValidationException.ERROR_CODE, message, null);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleInput(ServerWebInputException ex) {
        log.warn("Unreadable request: {}", ex.getReason());
        return respond(HttpStatus.BAD_REQUEST, ReportValidationException.ERROR_CODE, ex.getReason(), null);
    }

    @ExceptionHandler(ReportNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(ReportNotFoundException ex) {
        log.debug("Not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex.getErrorCode(), ex.getMessage(), ex.getReportId());
    }

    @ExceptionHandler(ReportPipelineException.class)
    public ResponseEntity<Map<String, Object>> handlePipeline(ReportPipelineException ex) {
        log.error("Report pipeline error: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getErrorCode(), ex.getMessage(), ex.getReportId());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneric(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred", null);
    }

    private ResponseEntity<Map<String, Object>> respond(HttpStatus status, String errorCode, String message, String reportId) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("error", errorCode);
        response.put("message", message);
        response.put("status", status.value());
        response.put("timestamp", LocalDateTime.now().toString());

        if (reportId != null) {
            response.put("reportId", reportId);
        }

        return ResponseEntity.status(status).body(response);
    }
}
