package com.techStack.sessionGuard.controller.session;

import com.techStack.sessionGuard.dto.internal.RequestContext;
import com.techStack.sessionGuard.dto.request.CreateSessionRequest;
import com.techStack.sessionGuard.dto.request.RefreshSessionRequest;
import com.techStack.sessionGuard.dto.response.ApiResponse;
import com.techStack.sessionGuard.dto.response.SessionResponse;
import com.techStack.sessionGuard.dto.response.SessionStatusResponse;
import com.techStack.sessionGuard.models.session.LoginType;
import com.techStack.sessionGuard.models.session.SecurityLevel;
import com.techStack.sessionGuard.models.session.Session;
import com.techStack.sessionGuard.models.session.SessionCreationOptions;
import com.techStack.sessionGuard.models.session.SessionStats;
import com.techStack.sessionGuard.models.session.SweepReport;
import com.techStack.sessionGuard.security.binding.SessionCookieBinder;
import com.techStack.sessionGuard.service.auth.RequestContextResolver;
import com.techStack.sessionGuard.service.maintenance.SecuritySweepService;
import com.techStack.sessionGuard.service.session.SessionManager;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Session Controller
 * Session lifecycle endpoints. Authentication and the {@code high} level
 * rules are enforced by the security chain; freshness is checked here.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/sessions")
public class SessionController {

    private final SessionManager sessionManager;
    private final SecuritySweepService sweepService;
    private final RequestContextResolver requestContextResolver;
    private final SessionCookieBinder binder;
    private final Clock clock;

    /* =========================
       Lifecycle
       ========================= */

    /**
     * Creates a session for a user already authenticated by a trusted caller.
     */
    @PostMapping
    public Mono<ResponseEntity<ApiResponse<SessionResponse>>> createSession(
            @Valid @RequestBody CreateSessionRequest request,
            ServerWebExchange exchange) {

        RequestContext context = requestContextResolver.resolve(exchange);
        SessionCreationOptions options = SessionCreationOptions.builder()
                .loginType(request.getLoginType() != null ? LoginType.fromValue(request.getLoginType()) : LoginType.PASSWORD)
                .rememberMe(request.isRememberMe())
                .maxAge(request.getMaxAge() != null ? Duration.ofMillis(request.getMaxAge()) : null)
                .securityLevel(request.getSecurityLevel() != null ? SecurityLevel.fromValue(request.getSecurityLevel()) : null)
                .build();

        return sessionManager.createSession(request.getUserId(), context, options)
                .map(issue -> {
                    binder.bindSession(exchange.getResponse(), issue.getSession(), issue.getRememberMeToken());
                    return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(
                            "Session created", SessionResponse.of(issue.getSession(), true, true), clock.instant()));
                });
    }

    @GetMapping("/validate")
    public Mono<ResponseEntity<ApiResponse<SessionResponse>>> validate(
            @AuthenticationPrincipal Session session,
            ServerWebExchange exchange) {

        binder.writeSessionHeaders(exchange.getResponse().getHeaders(), session);
        return Mono.just(ResponseEntity.ok(ApiResponse.success(
                "Session is valid", SessionResponse.of(session, true, true), clock.instant())));
    }

    @PostMapping("/refresh")
    public Mono<ResponseEntity<ApiResponse<SessionResponse>>> refresh(
            @AuthenticationPrincipal Session session,
            @Valid @RequestBody(required = false) RefreshSessionRequest request,
            ServerWebExchange exchange) {

        Duration maxAge = request != null && request.getMaxAge() != null ? Duration.ofMillis(request.getMaxAge()) : null;

        return sessionManager.refreshSession(session.getSessionId(), maxAge)
                .map(refreshed -> {
                    binder.bindSessionCookie(exchange.getResponse(), refreshed);
                    return ResponseEntity.ok(ApiResponse.success(
                            "Session refreshed", SessionResponse.of(refreshed, true, true), clock.instant()));
                });
    }

    @PostMapping("/rotate")
    public Mono<ResponseEntity<ApiResponse<SessionResponse>>> rotate(
            @AuthenticationPrincipal Session session,
            ServerWebExchange exchange) {

        return sessionManager.rotateSession(session.getSessionId())
                .map(rotated -> {
                    binder.bindSessionCookie(exchange.getResponse(), rotated);
                    return ResponseEntity.ok(ApiResponse.success(
                            "Session rotated", SessionResponse.of(rotated, true, true), clock.instant()));
                });
    }

    @DeleteMapping("/current")
    public Mono<ResponseEntity<ApiResponse<Void>>> destroyCurrent(
            @AuthenticationPrincipal Session session,
            ServerWebExchange exchange) {

        return sessionManager.revokeRememberMeToken(binder.resolveRememberMeToken(exchange.getRequest()))
                .then(sessionManager.destroySession(session.getSessionId(), "user_request"))
                .map(removed -> {
                    binder.clearSessionCookies(exchange.getResponse());
                    return ResponseEntity.ok(ApiResponse.success("Session destroyed", clock.instant()));
                });
    }

    /**
     * Signs out every other device. Requires a recently created session.
     */
    @DeleteMapping("/others")
    public Mono<ResponseEntity<ApiResponse<Map<String, Object>>>> destroyOthers(@AuthenticationPrincipal Session session) {
        return sessionManager.assertFresh(session)
                .flatMap(current -> sessionManager.destroyAllUserSessions(
                        current.getUserId(), current.getSessionId(), "sign_out_others"))
                .map(count -> ResponseEntity.ok(ApiResponse.success("Other sessions destroyed",
                        Map.<String, Object>of("sessionsDestroyed", count), clock.instant())));
    }

    /* =========================
       Queries
       ========================= */

    @GetMapping
    public Mono<ResponseEntity<ApiResponse<List<SessionResponse>>>> listSessions(@AuthenticationPrincipal Session session) {
        return sessionManager.getUserSessions(session.getUserId())
                .map(candidate -> {
                    boolean current = candidate.getSessionId().equals(session.getSessionId());
                    return SessionResponse.of(candidate, current, current);
                })
                .collectList()
                .map(sessions -> ResponseEntity.ok(ApiResponse.success("Active sessions", sessions, clock.instant())));
    }

    /**
     * Reports whether the request carries a valid session, without failing when it does not.
     */
    @GetMapping("/status")
    public Mono<ResponseEntity<ApiResponse<SessionStatusResponse>>> status(ServerWebExchange exchange) {
        String sessionId = binder.resolveSessionId(exchange.getRequest());

        return sessionManager.validateSession(sessionId, requestContextResolver.resolve(exchange))
                .map(result -> result.isValid()
                        ? new SessionStatusResponse(true, null, SessionResponse.of(result.getSession(), true, false))
                        : new SessionStatusResponse(false, result.getReason().getValue(), null))
                .map(status -> ResponseEntity.ok(ApiResponse.success("Session status", status, clock.instant())));
    }

    @GetMapping("/stats")
    public Mono<ResponseEntity<ApiResponse<SessionStats>>> stats() {
        return sessionManager.getSessionStats()
                .map(stats -> ResponseEntity.ok(ApiResponse.success("Session statistics", stats, clock.instant())));
    }

    @PostMapping("/cleanup")
    public Mono<ResponseEntity<ApiResponse<SweepReport>>> cleanup(@AuthenticationPrincipal Session session) {
        log.info("Manual security sweep requested by user {}", session.getUserId());
        return sweepService.runSweep()
                .map(report -> ResponseEntity.ok(ApiResponse.success("Cleanup completed", report, clock.instant())));
    }
}
