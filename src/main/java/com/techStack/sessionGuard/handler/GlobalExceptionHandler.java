package com.techStack.sessionGuard.handler;

import com.techStack.sessionGuard.exception.service.CustomException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Global Exception Handler
 *
 * Provides consistent error responses across the application.
 * Uses Clock for timestamp tracking.
 */
@Slf4j
@RestControllerAdvice
@Order(Ordered.HIGHEST_PRECEDENCE)
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private final ErrorResponseFactory errorResponseFactory;
    private final Clock clock;

    /* =========================
       Domain Exceptions
       ========================= */

    @ExceptionHandler(CustomException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleCustomException(
            CustomException ex, ServerWebExchange exchange) {

        HttpStatus status = ex.getStatus();
        String path = exchange.getRequest().getPath().value();

        if (status.is5xxServerError()) {
            log.error("{} on {}: {}", ex.getCode(), path, ex.getMessage(), ex.getCause());
        } else {
            log.debug("{} on {}: {}", ex.getCode(), path, ex.getMessage());
        }

        return Mono.just(ResponseEntity
                .status(status)
                .headers(errorResponseFactory.headers(ex))
                .body(errorResponseFactory.body(ex)));
    }

    /* =========================
       Validation Exceptions
       ========================= */

    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleValidationException(WebExchangeBindException ex) {
        Instant now = clock.instant();

        Map<String, String> errors = new LinkedHashMap<>();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            errors.putIfAbsent(fieldError.getField(), fieldError.getDefaultMessage());
        }

        Map<String, Object> body = errorResponseFactory.base(
                HttpStatus.BAD_REQUEST, "Validation failed", "VALIDATION_ERROR", now);
        body.put("errors", errors);

        log.debug("Validation failed at {}: {}", now, errors);
        return Mono.just(ResponseEntity.badRequest().body(body));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleInputException(ServerWebInputException ex) {
        Map<String, Object> body = errorResponseFactory.base(
                HttpStatus.BAD_REQUEST, "Malformed request", "VALIDATION_ERROR", clock.instant());
        body.put("details", ex.getReason());
        return Mono.just(ResponseEntity.badRequest().body(body));
    }

    /* =========================
       Fallback
       ========================= */

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleUnexpected(Exception ex, ServerWebExchange exchange) {
        log.error("Unhandled error on {}: {}", exchange.getRequest().getPath().value(), ex.getMessage(), ex);
        Map<String, Object> body = errorResponseFactory.base(
                HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", "INTERNAL_ERROR", clock.instant());
        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body));
    }
}
