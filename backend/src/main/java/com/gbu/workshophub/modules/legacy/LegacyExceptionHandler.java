package com.gbu.workshophub.modules.legacy;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Keeps the legacy {@code {success, data, error}} envelope on every failure of the
 * legacy controller; the rest of the API uses {@code GlobalExceptionHandler}.
 */
@Slf4j
@Order(Ordered.HIGHEST_PRECEDENCE)
@RestControllerAdvice(assignableTypes = LegacyWorkshopController.class)
public class LegacyExceptionHandler {

    @ExceptionHandler(LegacyApiException.class)
    public ResponseEntity<LegacyResponse<Map<String, Object>>> handleLegacy(LegacyApiException ex,
            HttpServletRequest request) {
        log.warn("[{}] {} {}: {}", ex.getStatus().value(), request.getMethod(), request.getRequestURI(),
                ex.getMessage());
        return ResponseEntity.status(ex.getStatus()).body(LegacyResponse.failure(ex.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<LegacyResponse<Map<String, Object>>> handleUnreadable(HttpMessageNotReadableException ex,
            HttpServletRequest request) {
        log.warn("[400] {} {}: unreadable body", request.getMethod(), request.getRequestURI());
        return ResponseEntity.badRequest().body(LegacyResponse.failure(LegacyWorkshopService.INVALID_BODY));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<LegacyResponse<Map<String, Object>>> handleUnexpected(Exception ex,
            HttpServletRequest request) {
        log.error("[500] {} {}: {}", request.getMethod(), request.getRequestURI(), ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(LegacyResponse.failure("An unexpected error occurred. Please try again later."));
    }
}
