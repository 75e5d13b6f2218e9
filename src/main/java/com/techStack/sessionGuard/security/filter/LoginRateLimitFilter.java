package com.techStack.sessionGuard.security.filter;

import com.techStack.sessionGuard.config.RateLimitProperties;
import com.techStack.sessionGuard.exception.security.RateLimitExceededException;
import com.techStack.sessionGuard.handler.ErrorResponseFactory;
import com.techStack.sessionGuard.models.security.RateLimitDecision;
import com.techStack.sessionGuard.repository.security.LoginRateLimiter;
import com.techStack.sessionGuard.service.auth.RequestContextResolver;
import com.techStack.sessionGuard.service.observability.AuditLogService;
import com.techStack.sessionGuard.util.validation.HelperUtils;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static com.techStack.sessionGuard.constants.SecurityConstants.HEADER_RATE_LIMIT_LIMIT;
import static com.techStack.sessionGuard.constants.SecurityConstants.HEADER_RATE_LIMIT_REMAINING;
import static com.techStack.sessionGuard.constants.SecurityConstants.HEADER_RATE_LIMIT_RESET;

/**
 * Login Rate Limit Filter
 *
 * IP-keyed pre-filter in front of the login route. Runs ahead of the
 * security chain and independently of account lockout. A failing store
 * lets the request through.
 * Uses Clock for all timestamp operations.
 */
@Component
@Order(-200)
@RequiredArgsConstructor
public class LoginRateLimitFilter implements WebFilter {

    private static final Logger logger = LoggerFactory.getLogger(LoginRateLimitFilter.class);

    private final LoginRateLimiter rateLimiter;
    private final RateLimitProperties properties;
    private final RequestContextResolver requestContextResolver;
    private final ErrorResponseFactory errorResponseFactory;
    private final AuditLogService auditLogService;
    private final Clock clock;

    /* =========================
       Filter Implementation
       ========================= */

    @NonNull
    @Override
    public Mono<Void> filter(@NonNull ServerWebExchange exchange, @NonNull WebFilterChain chain) {
        if (!appliesTo(exchange)) {
            return chain.filter(exchange);
        }

        String ip = requestContextResolver.extractClientIp(exchange);

        return rateLimiter.tryAcquire(ip)
                .map(Optional::of)
                .onErrorResume(e -> {
                    logger.warn("Login rate limiter unavailable, allowing request: {}", e.getMessage());
                    auditLogService.logFailOpen("login_rate_limit", HelperUtils.maskIpAddress(ip), e);
                    return Mono.just(Optional.<RateLimitDecision>empty());
                })
                .defaultIfEmpty(Optional.<RateLimitDecision>empty())
                .flatMap(decision -> {
                    if (decision.isEmpty()) {
                        return chain.filter(exchange);
                    }
                    writeHeaders(exchange.getResponse().getHeaders(), decision.get());
                    return decision.get().isAllowed()
                            ? chain.filter(exchange)
                            : reject(exchange, ip, decision.get());
                });
    }

    private boolean appliesTo(ServerWebExchange exchange) {
        return properties.isEnabled()
                && HttpMethod.POST.equals(exchange.getRequest().getMethod())
                && properties.getPath().equals(exchange.getRequest().getPath().value());
    }

    /* =========================
       Rejection
       ========================= */

    private Mono<Void> reject(ServerWebExchange exchange, String ip, RateLimitDecision decision) {
        Instant now = clock.instant();
        long retryAfterSeconds = Math.max(1, (Duration.between(now, decision.getResetAt()).toMillis() + 999) / 1000);

        auditLogService.logSecurityEvent("LOGIN_RATE_LIMIT_EXCEEDED", HelperUtils.maskIpAddress(ip), Map.of(
                "limit", decision.getLimit(),
                "path", exchange.getRequest().getPath().value()));

        return errorResponseFactory.write(exchange, new RateLimitExceededException(
                decision.getLimit(), properties.getWindow(), decision.getResetAt(), retryAfterSeconds));
    }

    private void writeHeaders(HttpHeaders headers, RateLimitDecision decision) {
        headers.set(HEADER_RATE_LIMIT_LIMIT, String.valueOf(decision.getLimit()));
        headers.set(HEADER_RATE_LIMIT_REMAINING, String.valueOf(decision.getRemaining()));
        headers.set(HEADER_RATE_LIMIT_RESET, decision.getResetAt().toString());
    }
}
