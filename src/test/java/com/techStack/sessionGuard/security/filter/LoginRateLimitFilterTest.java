package com.techStack.sessionGuard.security.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.techStack.sessionGuard.config.RateLimitProperties;
import com.techStack.sessionGuard.config.SessionProperties;
import com.techStack.sessionGuard.handler.ErrorResponseFactory;
import com.techStack.sessionGuard.models.security.RateLimitDecision;
import com.techStack.sessionGuard.repository.security.LoginRateLimiter;
import com.techStack.sessionGuard.security.binding.SessionCookieBinder;
import com.techStack.sessionGuard.service.auth.RequestContextResolver;
import com.techStack.sessionGuard.service.observability.AuditLogService;
import com.techStack.sessionGuard.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class LoginRateLimitFilterTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
    private static final String IP = "203.0.113.7";

    @Mock
    private LoginRateLimiter rateLimiter;

    @Mock
    private AuditLogService auditLogService;

    private LoginRateLimitFilter filter;
    private AtomicBoolean chainCalled;
    private WebFilterChain chain;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        MutableClock clock = new MutableClock(NOW);
        ErrorResponseFactory errorResponseFactory = new ErrorResponseFactory(
                new SessionCookieBinder(new SessionProperties(), clock),
                new ObjectMapper().registerModule(new JavaTimeModule()),
                clock);
        filter = new LoginRateLimitFilter(rateLimiter, new RateLimitProperties(), new RequestContextResolver(),
                errorResponseFactory, auditLogService, clock);

        chainCalled = new AtomicBoolean();
        chain = exchange -> {
            chainCalled.set(true);
            return Mono.empty();
        };
    }

    @Test
    void otherRoutes_areNotCounted() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/sessions")
                .remoteAddress(new InetSocketAddress(IP, 443)));

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        assertThat(chainCalled).isTrue();
        verifyNoInteractions(rateLimiter);
    }

    @Test
    void admittedLogin_continuesWithRateLimitHeaders() {
        when(rateLimiter.tryAcquire(IP)).thenReturn(Mono.just(
                new RateLimitDecision(true, 10, 7, NOW.plus(Duration.ofMinutes(10)))));
        MockServerWebExchange exchange = loginExchange();

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        assertThat(chainCalled).isTrue();
        HttpHeaders headers = exchange.getResponse().getHeaders();
        assertThat(headers.getFirst("X-Login-RateLimit-Limit")).isEqualTo("10");
        assertThat(headers.getFirst("X-Login-RateLimit-Remaining")).isEqualTo("7");
        assertThat(headers.getFirst("X-Login-RateLimit-Reset")).isEqualTo(NOW.plus(Duration.ofMinutes(10)).toString());
    }

    @Test
    void exhaustedWindow_isRejectedWith429() {
        when(rateLimiter.tryAcquire(IP)).thenReturn(Mono.just(
                new RateLimitDecision(false, 10, 0, NOW.plusMillis(61_500))));
        MockServerWebExchange exchange = loginExchange();

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        assertThat(chainCalled).isFalse();
        assertThat(exchange.getResponse().getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
        assertThat(exchange.getResponse().getHeaders().getFirst(HttpHeaders.RETRY_AFTER)).isEqualTo("62");
        assertThat(exchange.getResponse().getBodyAsString().block())
                .contains("\"code\":\"RATE_LIMIT_EXCEEDED\"")
                .contains("\"retryAfter\":62")
                .contains("\"windowMs\":900000");
        verify(auditLogService).logSecurityEvent(eq("LOGIN_RATE_LIMIT_EXCEEDED"), anyString(), any());
    }

    @Test
    void limiterFailure_letsTheRequestThrough() {
        when(rateLimiter.tryAcquire(IP)).thenReturn(Mono.error(new IllegalStateException("redis down")));
        MockServerWebExchange exchange = loginExchange();

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        assertThat(chainCalled).isTrue();
        assertThat(exchange.getResponse().getHeaders().containsKey("X-Login-RateLimit-Limit")).isFalse();
        verify(auditLogService).logFailOpen(eq("login_rate_limit"), anyString(), any(IllegalStateException.class));
    }

    private static MockServerWebExchange loginExchange() {
        return MockServerWebExchange.from(MockServerHttpRequest.post("/api/auth/login")
                .remoteAddress(new InetSocketAddress(IP, 443)));
    }
}
