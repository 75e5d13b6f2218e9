package com.techStack.sessionGuard.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.techStack.sessionGuard.config.SessionProperties;
import com.techStack.sessionGuard.dto.request.LoginRequest;
import com.techStack.sessionGuard.exception.auth.AccountDisabledException;
import com.techStack.sessionGuard.exception.security.AccountLockedException;
import com.techStack.sessionGuard.exception.security.CaptchaRequiredException;
import com.techStack.sessionGuard.exception.security.SecurityValidationException;
import com.techStack.sessionGuard.exception.session.InsufficientSecurityLevelException;
import com.techStack.sessionGuard.exception.session.InvalidSessionException;
import com.techStack.sessionGuard.models.attempt.AttemptCounts;
import com.techStack.sessionGuard.models.security.LockoutReason;
import com.techStack.sessionGuard.models.security.LockoutStatus;
import com.techStack.sessionGuard.models.security.SecurityContext;
import com.techStack.sessionGuard.models.security.SubjectType;
import com.techStack.sessionGuard.models.security.SuspicionScore;
import com.techStack.sessionGuard.models.session.SecurityLevel;
import com.techStack.sessionGuard.models.session.SessionInvalidReason;
import com.techStack.sessionGuard.models.user.UserStatus;
import com.techStack.sessionGuard.security.binding.SessionCookieBinder;
import com.techStack.sessionGuard.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.validation.BeanPropertyBindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private GlobalExceptionHandler handler;
    private MockServerWebExchange exchange;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(NOW);
        ErrorResponseFactory factory = new ErrorResponseFactory(
                new SessionCookieBinder(new SessionProperties(), clock),
                new ObjectMapper().registerModule(new JavaTimeModule()),
                clock);
        handler = new GlobalExceptionHandler(factory, clock);
        exchange = MockServerWebExchange.from(MockServerHttpRequest.post("/api/auth/login"));
    }

    @Test
    void accountLocked_includesLockoutDetailsAndSecurityHeaders() {
        LockoutStatus lockout = LockoutStatus.builder()
                .subject("alice@example.com")
                .subjectType(SubjectType.USER)
                .locked(true)
                .reason(LockoutReason.TOO_MANY_ATTEMPTS)
                .lockedAt(NOW.minus(Duration.ofMinutes(2)))
                .expiresAt(NOW.plus(Duration.ofMinutes(9)).plusSeconds(30))
                .attempts(5)
                .threshold(5)
                .build();
        SecurityContext context = context(SuspicionScore.clean()).toBuilder().userLockout(lockout).build();

        ResponseEntity<Map<String, Object>> response =
                handler.handleCustomException(new AccountLockedException(lockout, context), exchange).block();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.LOCKED);
        assertThat(response.getHeaders().getFirst("X-User-Locked")).isEqualTo("true");
        Map<String, Object> body = response.getBody();
        assertThat(body).containsEntry("success", false)
                .containsEntry("code", "ACCOUNT_LOCKED")
                .containsEntry("timestamp", NOW.toString())
                .containsEntry("timestampMillis", NOW.toEpochMilli());
        @SuppressWarnings("unchecked")
        Map<String, Object> details = (Map<String, Object>) body.get("lockoutDetails");
        assertThat(details).containsEntry("reason", "too_many_attempts")
                .containsEntry("remainingTime", 10L);
    }

    @Test
    void captchaRequired_listsRiskFactors() {
        SecurityContext context = context(SuspicionScore.of(List.of("rapid_attempts"), 2));

        Map<String, Object> body = handler.handleCustomException(
                new CaptchaRequiredException(context, false), exchange).block().getBody();

        assertThat(body).containsEntry("captchaRequired", true)
                .doesNotContainKey("field")
                .containsEntry("code", "CAPTCHA_REQUIRED");
        @SuppressWarnings("unchecked")
        Map<String, Object> factors = (Map<String, Object>) body.get("riskFactors");
        assertThat(factors).containsEntry("suspiciousPatterns", List.of("rapid_attempts"));
    }

    @Test
    void securityValidation_reportsViolations() {
        SecurityContext context = context(SuspicionScore.of(List.of("a", "b"), 5));

        ResponseEntity<Map<String, Object>> response = handler.handleCustomException(
                new SecurityValidationException(List.of("a", "b"), 5, context), exchange).block();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(response.getBody()).containsEntry("violations", List.of("a", "b")).containsEntry("riskScore", 5);
    }

    @Test
    void sessionErrors_carryReasonAndLevels() {
        Map<String, Object> invalid = handler.handleCustomException(
                new InvalidSessionException(SessionInvalidReason.EXPIRED), exchange).block().getBody();
        Map<String, Object> insufficient = handler.handleCustomException(
                new InsufficientSecurityLevelException(SecurityLevel.HIGH, SecurityLevel.LOW), exchange).block().getBody();
        Map<String, Object> disabled = handler.handleCustomException(
                new AccountDisabledException(UserStatus.SUSPENDED), exchange).block().getBody();

        assertThat(invalid).containsEntry("code", "SESSION_INVALID").containsEntry("reason", "expired");
        assertThat(insufficient).containsEntry("requiredLevel", "high").containsEntry("currentLevel", "low");
        assertThat(disabled).containsEntry("accountStatus", "SUSPENDED");
    }

    @Test
    void bindErrors_becomeValidationErrors() throws NoSuchMethodException {
        BeanPropertyBindingResult bindingResult = new BeanPropertyBindingResult(new LoginRequest(), "loginRequest");
        bindingResult.addError(new FieldError("loginRequest", "identifier", "must not be blank"));
        MethodParameter parameter = new MethodParameter(
                GlobalExceptionHandlerTest.class.getDeclaredMethod("bindTarget", LoginRequest.class), 0);

        ResponseEntity<Map<String, Object>> response = handler.handleValidationException(
                new WebExchangeBindException(parameter, bindingResult)).block();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).containsEntry("code", "VALIDATION_ERROR")
                .containsEntry("errors", Map.of("identifier", "must not be blank"));
    }

    @Test
    void unexpectedErrors_doNotLeakDetails() {
        ResponseEntity<Map<String, Object>> response = handler.handleUnexpected(
                new IllegalStateException("connection string with password"), exchange).block();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody()).containsEntry("code", "INTERNAL_ERROR")
                .containsEntry("message", "An unexpected error occurred");
    }

    @SuppressWarnings("unused")
    private void bindTarget(LoginRequest request) {
    }

    private static SecurityContext context(SuspicionScore suspicion) {
        return SecurityContext.builder()
                .enabled(true)
                .identifier("alice@example.com")
                .ip("203.0.113.7")
                .suspicion(suspicion)
                .progressiveDelay(Duration.ZERO)
                .attempts(new AttemptCounts(3, 4))
                .evaluatedAt(NOW)
                .build();
    }
}
