package com.techStack.sessionGuard.security.authentication;

import com.techStack.sessionGuard.config.SessionProperties;
import com.techStack.sessionGuard.dto.internal.RequestContext;
import com.techStack.sessionGuard.models.session.LoginType;
import com.techStack.sessionGuard.models.session.SecurityLevel;
import com.techStack.sessionGuard.models.session.Session;
import com.techStack.sessionGuard.models.session.SessionInvalidReason;
import com.techStack.sessionGuard.models.session.SessionValidationResult;
import com.techStack.sessionGuard.security.binding.SessionCookieBinder;
import com.techStack.sessionGuard.service.auth.RequestContextResolver;
import com.techStack.sessionGuard.service.session.SessionManager;
import com.techStack.sessionGuard.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.security.core.GrantedAuthority;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;

import static com.techStack.sessionGuard.constants.SecurityConstants.ATTR_SESSION_INVALID_REASON;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class SessionSecurityContextRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    @Mock
    private SessionManager sessionManager;

    private SessionSecurityContextRepository repository;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        SessionProperties properties = new SessionProperties();
        properties.setTrustedCallerToken("s3rvice-t0ken");
        repository = new SessionSecurityContextRepository(sessionManager,
                new SessionCookieBinder(properties, new MutableClock(NOW)),
                new RequestContextResolver(), properties);
    }

    @Test
    void validSession_becomesAuthenticatedPrincipal() {
        Session session = session(SecurityLevel.STANDARD);
        when(sessionManager.validateSession(eq("abc123"), any(RequestContext.class)))
                .thenReturn(Mono.just(SessionValidationResult.valid(session)));

        StepVerifier.create(repository.load(exchangeWithBearer("abc123")))
                .assertNext(context -> {
                    assertThat(context.getAuthentication().isAuthenticated()).isTrue();
                    assertThat(context.getAuthentication().getPrincipal()).isEqualTo(session);
                    assertThat(context.getAuthentication().getName()).isEqualTo("user-001");
                    assertThat(context.getAuthentication().getAuthorities())
                            .extracting(GrantedAuthority::getAuthority)
                            .containsExactlyInAnyOrder("LEVEL_LOW", "LEVEL_STANDARD");
                })
                .verifyComplete();
    }

    @Test
    void invalidSession_leavesExchangeAnonymousWithReason() {
        when(sessionManager.validateSession(eq("abc123"), any(RequestContext.class)))
                .thenReturn(Mono.just(SessionValidationResult.invalid(SessionInvalidReason.EXPIRED)));
        MockServerWebExchange exchange = exchangeWithBearer("abc123");

        StepVerifier.create(repository.load(exchange)).verifyComplete();

        assertThat((Object) exchange.getAttribute(ATTR_SESSION_INVALID_REASON)).isEqualTo(SessionInvalidReason.EXPIRED);
    }

    @Test
    void noCredential_isMissingWithoutStoreLookup() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/sessions"));

        StepVerifier.create(repository.load(exchange)).verifyComplete();

        assertThat((Object) exchange.getAttribute(ATTR_SESSION_INVALID_REASON)).isEqualTo(SessionInvalidReason.MISSING);
        verifyNoInteractions(sessionManager);
    }

    @Test
    void serviceToken_loadsTrustedCallerWithoutSessionLevels() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.post("/api/sessions")
                .header("X-Service-Token", "s3rvice-t0ken"));

        StepVerifier.create(repository.load(exchange))
                .assertNext(context -> assertThat(context.getAuthentication().getAuthorities())
                        .extracting(GrantedAuthority::getAuthority)
                        .containsExactly(TrustedCallerAuthenticationToken.TRUSTED_CALLER))
                .verifyComplete();
        verifyNoInteractions(sessionManager);
    }

    @Test
    void wrongServiceToken_staysAnonymous() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.post("/api/sessions")
                .header("X-Service-Token", "guessed"));

        StepVerifier.create(repository.load(exchange)).verifyComplete();

        assertThat((Object) exchange.getAttribute(ATTR_SESSION_INVALID_REASON)).isEqualTo(SessionInvalidReason.MISSING);
    }

    @Test
    void blankConfiguredToken_acceptsNoServiceCaller() {
        SessionProperties closed = new SessionProperties();
        SessionSecurityContextRepository closedRepository = new SessionSecurityContextRepository(sessionManager,
                new SessionCookieBinder(closed, new MutableClock(NOW)), new RequestContextResolver(), closed);
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.post("/api/sessions")
                .header("X-Service-Token", ""));

        StepVerifier.create(closedRepository.load(exchange)).verifyComplete();
    }

    @Test
    void highSession_holdsEveryLevelAuthority() {
        SessionAuthenticationToken token = new SessionAuthenticationToken(session(SecurityLevel.HIGH));

        assertThat(token.getAuthorities())
                .extracting(GrantedAuthority::getAuthority)
                .containsExactlyInAnyOrder("LEVEL_LOW", "LEVEL_STANDARD", "LEVEL_HIGH");
        assertThat(SessionAuthenticationToken.authority(SecurityLevel.HIGH)).isEqualTo("LEVEL_HIGH");
    }

    private static MockServerWebExchange exchangeWithBearer(String sessionId) {
        return MockServerWebExchange.from(MockServerHttpRequest.get("/api/sessions")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + sessionId));
    }

    private static Session session(SecurityLevel level) {
        return Session.builder()
                .sessionId("abc123")
                .userId("user-001")
                .createdAt(NOW)
                .lastActivity(NOW)
                .expiresAt(NOW.plus(Duration.ofHours(1)))
                .maxAgeMillis(Duration.ofHours(1).toMillis())
                .loginType(LoginType.PASSWORD)
                .securityLevel(level)
                .build();
    }
}
