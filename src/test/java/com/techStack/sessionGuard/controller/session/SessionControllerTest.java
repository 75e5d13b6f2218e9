package com.techStack.sessionGuard.controller.session;

import com.techStack.sessionGuard.config.SessionProperties;
import com.techStack.sessionGuard.dto.internal.RequestContext;
import com.techStack.sessionGuard.dto.request.CreateSessionRequest;
import com.techStack.sessionGuard.dto.response.SessionResponse;
import com.techStack.sessionGuard.exception.session.InvalidSessionException;
import com.techStack.sessionGuard.models.session.LoginType;
import com.techStack.sessionGuard.models.session.SecurityLevel;
import com.techStack.sessionGuard.models.session.Session;
import com.techStack.sessionGuard.models.session.SessionCreationOptions;
import com.techStack.sessionGuard.models.session.SessionInvalidReason;
import com.techStack.sessionGuard.models.session.SessionIssue;
import com.techStack.sessionGuard.models.session.SessionValidationResult;
import com.techStack.sessionGuard.security.binding.SessionCookieBinder;
import com.techStack.sessionGuard.service.auth.RequestContextResolver;
import com.techStack.sessionGuard.service.maintenance.SecuritySweepService;
import com.techStack.sessionGuard.service.session.SessionManager;
import com.techStack.sessionGuard.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SessionControllerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    @Mock
    private SessionManager sessionManager;
    @Mock
    private SecuritySweepService sweepService;

    private SessionController controller;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        MutableClock clock = new MutableClock(NOW);
        controller = new SessionController(sessionManager, sweepService, new RequestContextResolver(),
                new SessionCookieBinder(new SessionProperties(), clock), clock);
    }

    @Test
    void createSession_mapsRequestToOptions() {
        Session session = session("abc123", NOW);
        when(sessionManager.createSession(eq("user-001"), any(RequestContext.class), any(SessionCreationOptions.class)))
                .thenReturn(Mono.just(new SessionIssue(session, null)));
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.post("/api/sessions"));

        CreateSessionRequest request = CreateSessionRequest.builder()
                .userId("user-001")
                .loginType("otp")
                .maxAge(Duration.ofHours(2).toMillis())
                .securityLevel("high")
                .build();

        StepVerifier.create(controller.createSession(request, exchange))
                .assertNext(response -> {
                    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
                    assertThat(response.getBody().getData().getSessionId()).isEqualTo("abc123");
                })
                .verifyComplete();

        ArgumentCaptor<SessionCreationOptions> options = ArgumentCaptor.forClass(SessionCreationOptions.class);
        verify(sessionManager).createSession(eq("user-001"), any(RequestContext.class), options.capture());
        assertThat(options.getValue().getLoginType()).isEqualTo(LoginType.OTP);
        assertThat(options.getValue().getSecurityLevel()).isEqualTo(SecurityLevel.HIGH);
        assertThat(options.getValue().getMaxAge()).isEqualTo(Duration.ofHours(2));
        assertThat(exchange.getResponse().getCookies().getFirst("sessionId").getValue()).isEqualTo("abc123");
    }

    @Test
    void listSessions_marksOnlyTheCurrentOne() {
        Session current = session("abc123", NOW);
        Session other = session("def456", NOW.minus(Duration.ofHours(1)));
        when(sessionManager.getUserSessions("user-001")).thenReturn(Flux.just(current, other));

        StepVerifier.create(controller.listSessions(current))
                .assertNext(response -> {
                    assertThat(response.getBody().getData())
                            .extracting(SessionResponse::isCurrent)
                            .containsExactly(true, false);
                    assertThat(response.getBody().getData().get(1).getSessionId()).isNull();
                })
                .verifyComplete();
    }

    @Test
    void destroyOthers_requiresFreshSession() {
        Session current = session("abc123", NOW.minus(Duration.ofHours(2)));
        when(sessionManager.assertFresh(current))
                .thenReturn(Mono.error(new InvalidSessionException(SessionInvalidReason.STALE)));

        StepVerifier.create(controller.destroyOthers(current))
                .expectErrorSatisfies(e -> assertThat(((InvalidSessionException) e).getCode()).isEqualTo("SESSION_STALE"))
                .verify();

        verify(sessionManager, never()).destroyAllUserSessions(anyString(), anyString(), anyString());
    }

    @Test
    void destroyOthers_keepsCurrentSession() {
        Session current = session("abc123", NOW);
        when(sessionManager.assertFresh(current)).thenReturn(Mono.just(current));
        when(sessionManager.destroyAllUserSessions("user-001", "abc123", "sign_out_others")).thenReturn(Mono.just(2L));

        StepVerifier.create(controller.destroyOthers(current))
                .assertNext(response -> assertThat(response.getBody().getData()).containsEntry("sessionsDestroyed", 2L))
                .verifyComplete();
    }

    @Test
    void status_reportsReasonWithoutFailing() {
        when(sessionManager.validateSession(isNull(), any(RequestContext.class)))
                .thenReturn(Mono.just(SessionValidationResult.invalid(SessionInvalidReason.MISSING)));
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/sessions/status"));

        StepVerifier.create(controller.status(exchange))
                .assertNext(response -> {
                    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
                    assertThat(response.getBody().getData().isAuthenticated()).isFalse();
                    assertThat(response.getBody().getData().getReason()).isEqualTo("missing");
                })
                .verifyComplete();
    }

    private static Session session(String id, Instant createdAt) {
        return Session.builder()
                .sessionId(id)
                .userId("user-001")
                .createdAt(createdAt)
                .lastActivity(createdAt)
                .expiresAt(createdAt.plus(Duration.ofHours(24)))
                .maxAgeMillis(Duration.ofHours(24).toMillis())
                .loginType(LoginType.PASSWORD)
                .securityLevel(SecurityLevel.STANDARD)
                .build();
    }
}
