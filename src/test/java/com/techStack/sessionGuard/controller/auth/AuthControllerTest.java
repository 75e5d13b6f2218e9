package com.techStack.sessionGuard.controller.auth;

import com.techStack.sessionGuard.config.SessionProperties;
import com.techStack.sessionGuard.dto.internal.LoginResult;
import com.techStack.sessionGuard.dto.internal.RequestContext;
import com.techStack.sessionGuard.dto.request.LoginRequest;
import com.techStack.sessionGuard.dto.request.LogoutRequest;
import com.techStack.sessionGuard.exception.session.InvalidSessionException;
import com.techStack.sessionGuard.models.attempt.AttemptCounts;
import com.techStack.sessionGuard.models.security.SecurityContext;
import com.techStack.sessionGuard.models.security.SuspicionScore;
import com.techStack.sessionGuard.models.session.LoginType;
import com.techStack.sessionGuard.models.session.RememberMeRefreshResult;
import com.techStack.sessionGuard.models.session.SecurityLevel;
import com.techStack.sessionGuard.models.session.Session;
import com.techStack.sessionGuard.models.session.SessionInvalidReason;
import com.techStack.sessionGuard.models.session.SessionIssue;
import com.techStack.sessionGuard.models.user.UserAccount;
import com.techStack.sessionGuard.security.binding.SessionCookieBinder;
import com.techStack.sessionGuard.service.auth.LoginOrchestrator;
import com.techStack.sessionGuard.service.auth.RequestContextResolver;
import com.techStack.sessionGuard.service.security.LockoutEvaluator;
import com.techStack.sessionGuard.service.session.SessionManager;
import com.techStack.sessionGuard.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.HttpCookie;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseCookie;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AuthControllerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    @Mock
    private LoginOrchestrator loginOrchestrator;
    @Mock
    private SessionManager sessionManager;
    @Mock
    private LockoutEvaluator lockoutEvaluator;

    private AuthController controller;
    private Session session;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        MutableClock clock = new MutableClock(NOW);
        controller = new AuthController(loginOrchestrator, sessionManager, lockoutEvaluator,
                new RequestContextResolver(), new SessionCookieBinder(new SessionProperties(), clock), clock);

        session = Session.builder()
                .sessionId("abc123")
                .userId("user-001")
                .createdAt(NOW)
                .lastActivity(NOW)
                .expiresAt(NOW.plus(Duration.ofDays(7)))
                .maxAgeMillis(Duration.ofDays(7).toMillis())
                .loginType(LoginType.PASSWORD)
                .securityLevel(SecurityLevel.STANDARD)
                .rememberMe(true)
                .build();
    }

    @Test
    void login_setsCookiesAndSecurityHeaders() {
        SecurityContext securityContext = SecurityContext.builder()
                .enabled(true)
                .suspicion(SuspicionScore.clean())
                .progressiveDelay(Duration.ofSeconds(2))
                .attempts(AttemptCounts.empty())
                .evaluatedAt(NOW)
                .build();
        UserAccount user = UserAccount.builder().id("user-001").active(true).build();
        when(loginOrchestrator.login(any(LoginRequest.class), any(RequestContext.class), eq("cap-1")))
                .thenReturn(Mono.just(new LoginResult(user, new SessionIssue(session, "raw-token"), securityContext)));
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.post("/api/auth/login"));

        LoginRequest request = LoginRequest.builder().identifier("jane@example.com").password("secret").rememberMe(true).build();

        StepVerifier.create(controller.login(request, "cap-1", exchange))
                .assertNext(response -> {
                    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
                    assertThat(response.getBody().isSuccess()).isTrue();
                    assertThat(response.getBody().getData().getUserId()).isEqualTo("user-001");
                    assertThat(response.getBody().getData().isRememberMe()).isTrue();
                    assertThat(response.getBody().getData().getSecurity().getProgressiveDelay()).isEqualTo(2000L);
                })
                .verifyComplete();

        ResponseCookie sessionCookie = exchange.getResponse().getCookies().getFirst("sessionId");
        assertThat(sessionCookie.getValue()).isEqualTo("abc123");
        assertThat(sessionCookie.getMaxAge()).isEqualTo(Duration.ofDays(7));
        assertThat(exchange.getResponse().getCookies().getFirst("rememberMe").getValue()).isEqualTo("raw-token");
        assertThat(exchange.getResponse().getHeaders().getFirst("X-Session-ID")).isEqualTo("abc123");
        assertThat(exchange.getResponse().getHeaders().getFirst("X-Progressive-Delay")).isEqualTo("2000");
    }

    @Test
    void logout_destroysCurrentSessionAndClearsCookies() {
        when(sessionManager.revokeRememberMeToken(isNull())).thenReturn(Mono.just(false));
        when(sessionManager.destroySession("abc123", "logout")).thenReturn(Mono.just(true));
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.post("/api/auth/logout"));

        StepVerifier.create(controller.logout(session, null, exchange))
                .assertNext(response -> {
                    assertThat(response.getBody().getData()).containsEntry("sessionsDestroyed", 1L);
                    assertThat(response.getBody().getData()).containsEntry("allDevices", false);
                })
                .verifyComplete();

        assertThat(exchange.getResponse().getCookies().getFirst("sessionId").getMaxAge()).isEqualTo(Duration.ZERO);
        verify(sessionManager, never()).destroyAllUserSessions(any(), any(), any());
    }

    @Test
    void logoutAllDevices_destroysEverySession() {
        when(sessionManager.revokeRememberMeToken(isNull())).thenReturn(Mono.just(false));
        when(sessionManager.destroyAllUserSessions("user-001", null, "logout_all")).thenReturn(Mono.just(3L));
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.post("/api/auth/logout"));

        LogoutRequest logoutRequest = new LogoutRequest();
        logoutRequest.setAllDevices(true);

        StepVerifier.create(controller.logout(session, logoutRequest, exchange))
                .assertNext(response -> assertThat(response.getBody().getData()).containsEntry("sessionsDestroyed", 3L))
                .verifyComplete();
    }

    @Test
    void rememberMe_rebindsRefreshedSession() {
        when(sessionManager.refreshFromRememberMeToken(eq("old-token"), any(RequestContext.class)))
                .thenReturn(Mono.just(RememberMeRefreshResult.success(session, "new-token")));
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.post("/api/auth/remember-me")
                .cookie(new HttpCookie("rememberMe", "old-token")));

        StepVerifier.create(controller.rememberMe(exchange))
                .assertNext(response -> assertThat(response.getBody().getData().getSessionId()).isEqualTo("abc123"))
                .verifyComplete();

        assertThat(exchange.getResponse().getCookies().getFirst("rememberMe").getValue()).isEqualTo("new-token");
    }

    @Test
    void rememberMeFailure_clearsCookiesAndRejects() {
        when(sessionManager.refreshFromRememberMeToken(isNull(), any(RequestContext.class)))
                .thenReturn(Mono.just(RememberMeRefreshResult.failure("missing")));
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.post("/api/auth/remember-me"));

        StepVerifier.create(controller.rememberMe(exchange))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(InvalidSessionException.class);
                    assertThat(((InvalidSessionException) e).getReason()).isEqualTo(SessionInvalidReason.MISSING);
                })
                .verify();

        assertThat(exchange.getResponse().getCookies().getFirst("rememberMe").getMaxAge()).isEqualTo(Duration.ZERO);
    }
}
