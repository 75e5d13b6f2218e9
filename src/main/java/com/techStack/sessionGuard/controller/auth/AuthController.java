package com.techStack.sessionGuard.controller.auth;

import com.techStack.sessionGuard.dto.internal.LoginResult;
import com.techStack.sessionGuard.dto.internal.RequestContext;
import com.techStack.sessionGuard.dto.request.LoginRequest;
import com.techStack.sessionGuard.dto.request.LogoutRequest;
import com.techStack.sessionGuard.dto.response.ApiResponse;
import com.techStack.sessionGuard.dto.response.LoginResponse;
import com.techStack.sessionGuard.dto.response.SessionResponse;
import com.techStack.sessionGuard.exception.session.InvalidSessionException;
import com.techStack.sessionGuard.models.attempt.LoginAttemptStats;
import com.techStack.sessionGuard.models.session.Session;
import com.techStack.sessionGuard.models.session.SessionInvalidReason;
import com.techStack.sessionGuard.security.binding.SessionCookieBinder;
import com.techStack.sessionGuard.service.auth.LoginOrchestrator;
import com.techStack.sessionGuard.service.auth.RequestContextResolver;
import com.techStack.sessionGuard.service.security.LockoutEvaluator;
import com.techStack.sessionGuard.service.session.SessionManager;
import com.techStack.sessionGuard.util.validation.HelperUtils;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Map;

import static com.techStack.sessionGuard.constants.SecurityConstants.HEADER_CAPTCHA_TOKEN;
import static com.techStack.sessionGuard.constants.SecurityConstants.UNKNOWN_IDENTIFIER;

/**
 * Authentication Controller
 * Password login, logout and remember-me sign-in.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/auth")
public class AuthController {

    private final LoginOrchestrator loginOrchestrator;
    private final SessionManager sessionManager;
    private final LockoutEvaluator lockoutEvaluator;
    private final RequestContextResolver requestContextResolver;
    private final SessionCookieBinder binder;
    private final Clock clock;

    @PostMapping("/login")
    public Mono<ResponseEntity<ApiResponse<LoginResponse>>> login(
            @Valid @RequestBody LoginRequest loginRequest,
            @RequestHeader(value = HEADER_CAPTCHA_TOKEN, required = false) String captchaHeader,
            ServerWebExchange exchange) {

        RequestContext context = requestContextResolver.resolve(exchange);
        log.info("Login attempt for: {} from IP: {}",
                HelperUtils.maskIdentifier(loginRequest.getIdentifier()), HelperUtils.maskIpAddress(context.getIp()));

        return loginOrchestrator.login(loginRequest, context, captchaHeader)
                .map(result -> {
                    bindLogin(exchange, result);
                    return ResponseEntity.ok(ApiResponse.success("Login successful", toResponse(result), clock.instant()));
                });

        // Error handling delegated to GlobalExceptionHandler
    }

    @PostMapping("/logout")
    public Mono<ResponseEntity<ApiResponse<Map<String, Object>>>> logout(
            @AuthenticationPrincipal Session session,
            @RequestBody(required = false) LogoutRequest logoutRequest,
            ServerWebExchange exchange) {

        boolean allDevices = logoutRequest != null && logoutRequest.isAllDevices();
        String rememberMeToken = binder.resolveRememberMeToken(exchange.getRequest());

        Mono<Long> destroyed = allDevices
                ? sessionManager.destroyAllUserSessions(session.getUserId(), null, "logout_all")
                : sessionManager.destroySession(session.getSessionId(), "logout").map(removed -> removed ? 1L : 0L);

        return sessionManager.revokeRememberMeToken(rememberMeToken)
                .then(destroyed)
                .map(count -> {
                    binder.clearSessionCookies(exchange.getResponse());
                    log.info("User {} logged out ({} sessions)", session.getUserId(), count);
                    return ResponseEntity.ok(ApiResponse.success("Logged out successfully",
                            Map.<String, Object>of("sessionsDestroyed", count, "allDevices", allDevices),
                            clock.instant()));
                });
    }

    @PostMapping("/remember-me")
    public Mono<ResponseEntity<ApiResponse<SessionResponse>>> rememberMe(ServerWebExchange exchange) {
        String token = binder.resolveRememberMeToken(exchange.getRequest());
        RequestContext context = requestContextResolver.resolve(exchange);

        return sessionManager.refreshFromRememberMeToken(token, context)
                .map(result -> {
                    if (!result.isSuccess()) {
                        binder.clearSessionCookies(exchange.getResponse());
                        throw new InvalidSessionException(SessionInvalidReason.fromValue(result.getReason()));
                    }
                    binder.bindSession(exchange.getResponse(), result.getSession(), result.getRememberMeToken());
                    return ResponseEntity.ok(ApiResponse.success("Session restored",
                            SessionResponse.of(result.getSession(), true, true), clock.instant()));
                });
    }

    @GetMapping("/login-stats")
    public Mono<ResponseEntity<ApiResponse<LoginAttemptStats>>> loginStats(
            @RequestParam(value = "identifier", required = false) String identifier,
            @RequestParam(value = "ip", required = false) String ip,
            ServerWebExchange exchange) {

        String subjectIp = ip != null ? ip : requestContextResolver.extractClientIp(exchange);
        String subject = identifier != null ? HelperUtils.normalizeIdentifier(identifier) : UNKNOWN_IDENTIFIER;

        return lockoutEvaluator.getLoginAttemptStats(subject, subjectIp)
                .map(stats -> ResponseEntity.ok(ApiResponse.success("Login statistics", stats, clock.instant())));
    }

    /* =========================
       Helpers
       ========================= */

    private void bindLogin(ServerWebExchange exchange, LoginResult result) {
        binder.bindSession(exchange.getResponse(), result.getIssue().getSession(), result.getIssue().getRememberMeToken());
        binder.writeSecurityHeaders(exchange.getResponse().getHeaders(), result.getSecurityContext());
    }

    private LoginResponse toResponse(LoginResult result) {
        return LoginResponse.builder()
                .userId(result.getUser().getId())
                .session(SessionResponse.of(result.getIssue().getSession(), true, true))
                .rememberMe(result.getIssue().hasRememberMeToken())
                .security(LoginResponse.SecurityInfo.builder()
                        .enabled(result.getSecurityContext().isEnabled())
                        .captchaRequired(result.getSecurityContext().isCaptchaRequired())
                        .suspiciousActivity(result.getSecurityContext().isSuspicious())
                        .progressiveDelay(result.getSecurityContext().getProgressiveDelayMillis())
                        .build())
                .build();
    }
}
