package com.techStack.sessionGuard.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.techStack.sessionGuard.exception.auth.AccountDisabledException;
import com.techStack.sessionGuard.exception.security.AccountLockedException;
import com.techStack.sessionGuard.exception.security.CaptchaRequiredException;
import com.techStack.sessionGuard.exception.security.IpBlockedException;
import com.techStack.sessionGuard.exception.security.RateLimitExceededException;
import com.techStack.sessionGuard.exception.security.SecurityValidationException;
import com.techStack.sessionGuard.exception.service.CustomException;
import com.techStack.sessionGuard.exception.session.InsufficientSecurityLevelException;
import com.techStack.sessionGuard.exception.session.InvalidSessionException;
import com.techStack.sessionGuard.models.security.LockoutStatus;
import com.techStack.sessionGuard.models.security.SecurityContext;
import com.techStack.sessionGuard.security.binding.SessionCookieBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Error Response Factory
 *
 * Builds the JSON error bodies and headers for {@link CustomException}s.
 * Shared by the exception handler and by filters that answer before a
 * controller is reached.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ErrorResponseFactory {

    private final SessionCookieBinder binder;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /* =========================
       Bodies
       ========================= */

    public Map<String, Object> body(CustomException ex) {
        Instant now = clock.instant();
        HttpStatus status = ex.getStatus();

        Map<String, Object> body = base(status, ex.getMessage(), ex.getCode(), now);
        if (ex instanceof AccountLockedException locked) {
            body.put("lockoutDetails", lockoutDetails(locked.getLockout(), now));
        } else if (ex instanceof IpBlockedException blocked) {
            body.put("blockDetails", lockoutDetails(blocked.getBlock(), now));
        } else if (ex instanceof CaptchaRequiredException captcha) {
            body.put("captchaRequired", true);
            body.put("riskFactors", riskFactors(captcha.getSecurityContext()));
        } else if (ex instanceof RateLimitExceededException rateLimit) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("limit", rateLimit.getLimit());
            details.put("windowMs", rateLimit.getWindow().toMillis());
            details.put("retryAfter", rateLimit.getRetryAfterSeconds());
            body.put("rateLimitDetails", details);
        } else if (ex instanceof SecurityValidationException validation) {
            body.put("violations", validation.getViolations());
            body.put("riskScore", validation.getRiskScore());
        } else if (ex instanceof InvalidSessionException invalid) {
            body.put("reason", invalid.getReason().getValue());
        } else if (ex instanceof InsufficientSecurityLevelException level) {
            body.put("requiredLevel", level.getRequiredLevel().getValue());
            body.put("currentLevel", level.getCurrentLevel() != null ? level.getCurrentLevel().getValue() : null);
        } else if (ex instanceof AccountDisabledException disabled && disabled.getAccountStatus() != null) {
            body.put("accountStatus", disabled.getAccountStatus().name());
        }

        return body;
    }

    public Map<String, Object> base(HttpStatus status, String message, String code, Instant now) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", status.getReasonPhrase());
        body.put("message", message);
        body.put("code", code);
        body.put("timestamp", now.toString());
        body.put("timestampMillis", now.toEpochMilli());
        return body;
    }

    private Map<String, Object> lockoutDetails(LockoutStatus lockout, Instant now) {
        Map<String, Object> details = new LinkedHashMap<>();
        if (lockout == null) {
            return details;
        }
        details.put("reason", lockout.getReason() != null ? lockout.getReason().getValue() : null);
        details.put("lockedAt", lockout.getLockedAt() != null ? lockout.getLockedAt().toString() : null);
        details.put("expiresAt", lockout.getExpiresAt() != null ? lockout.getExpiresAt().toString() : null);
        details.put("remainingTime", lockout.remainingMinutes(now));
        return details;
    }

    private Map<String, Object> riskFactors(SecurityContext context) {
        Map<String, Object> attempts = new LinkedHashMap<>();
        attempts.put("userAttempts", context != null ? context.getAttempts().getIdentifierFailures() : 0);
        attempts.put("ipAttempts", context != null ? context.getAttempts().getIpFailures() : 0);

        Map<String, Object> factors = new LinkedHashMap<>();
        factors.put("attempts", attempts);
        factors.put("suspiciousPatterns", context != null && context.getSuspicion() != null
                ? context.getSuspicion().getReasons()
                : List.of());
        return factors;
    }

    /* =========================
       Headers
       ========================= */

    public HttpHeaders headers(CustomException ex) {
        HttpHeaders headers = new HttpHeaders();

        SecurityContext context = securityContextOf(ex);
        if (context != null) {
            binder.writeSecurityHeaders(headers, context);
        }
        if (ex instanceof RateLimitExceededException rateLimit) {
            headers.set(HttpHeaders.RETRY_AFTER, String.valueOf(rateLimit.getRetryAfterSeconds()));
        }
        return headers;
    }

    private SecurityContext securityContextOf(CustomException ex) {
        if (ex instanceof AccountLockedException locked) {
            return locked.getSecurityContext();
        }
        if (ex instanceof IpBlockedException blocked) {
            return blocked.getSecurityContext();
        }
        if (ex instanceof CaptchaRequiredException captcha) {
            return captcha.getSecurityContext();
        }
        if (ex instanceof SecurityValidationException validation) {
            return validation.getSecurityContext();
        }
        return null;
    }

    /* =========================
       Direct Writes
       ========================= */

    /**
     * Writes the error straight to the response, for code running outside
     * the controller layer.
     */
    public Mono<Void> write(ServerWebExchange exchange, CustomException ex) {
        ServerHttpResponse response = exchange.getResponse();
        response.setStatusCode(ex.getStatus());
        response.getHeaders().addAll(headers(ex));
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);

        byte[] payload;
        try {
            payload = objectMapper.writeValueAsBytes(body(ex));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize error body for {}: {}", ex.getCode(), e.getMessage());
            payload = ("{\"success\":false,\"code\":\"" + ex.getCode() + "\"}").getBytes(StandardCharsets.UTF_8);
        }

        return response.writeWith(Mono.just(response.bufferFactory().wrap(payload)));
    }
}
