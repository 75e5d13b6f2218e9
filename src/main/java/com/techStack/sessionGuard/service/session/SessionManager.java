package com.techStack.sessionGuard.service.session;

import com.techStack.sessionGuard.config.SessionProperties;
import com.techStack.sessionGuard.dto.internal.RequestContext;
import com.techStack.sessionGuard.exception.auth.AuthServiceUnavailableException;
import com.techStack.sessionGuard.exception.service.CustomException;
import com.techStack.sessionGuard.exception.session.InsufficientSecurityLevelException;
import com.techStack.sessionGuard.exception.session.InvalidSessionException;
import com.techStack.sessionGuard.exception.session.SessionException;
import com.techStack.sessionGuard.models.session.FingerprintPolicy;
import com.techStack.sessionGuard.models.session.LoginType;
import com.techStack.sessionGuard.models.session.RememberMeRefreshResult;
import com.techStack.sessionGuard.models.session.RememberMeToken;
import com.techStack.sessionGuard.models.session.SecurityLevel;
import com.techStack.sessionGuard.models.session.Session;
import com.techStack.sessionGuard.models.session.SessionCreationOptions;
import com.techStack.sessionGuard.models.session.SessionInvalidReason;
import com.techStack.sessionGuard.models.session.SessionIssue;
import com.techStack.sessionGuard.models.session.SessionState;
import com.techStack.sessionGuard.models.session.SessionStats;
import com.techStack.sessionGuard.models.session.SessionValidationResult;
import com.techStack.sessionGuard.repository.session.RememberMeTokenStore;
import com.techStack.sessionGuard.repository.session.SessionStore;
import com.techStack.sessionGuard.repository.user.UserDirectory;
import com.techStack.sessionGuard.service.observability.AuditLogService;
import com.techStack.sessionGuard.util.validation.HelperUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Session Manager
 *
 * Owns the session lifecycle: CREATED → ACTIVE → EXPIRED | DESTROYED.
 * Every read and write goes through {@link SessionStore}; nothing is cached
 * in process, so all instances see the same sessions.
 *
 * Records are stored for their remaining lifetime plus
 * {@code expiredRetention}, so a request shortly after expiry is answered
 * with {@code expired} rather than {@code not_found}.
 *
 * Uses Clock for all timestamps.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionManager {

    /* =========================
       Dependencies
       ========================= */

    private final SessionStore sessionStore;
    private final RememberMeTokenStore rememberMeTokenStore;
    private final UserDirectory userDirectory;
    private final SessionTokenGenerator tokenGenerator;
    private final SessionProperties properties;
    private final AuditLogService auditLogService;
    private final Clock clock;

    /* =========================
       Creation
       ========================= */

    /**
     * Creates and stores a session. A failed session write errors with
     * {@link SessionException}; a failed remember-me write only drops the token.
     */
    public Mono<SessionIssue> createSession(String userId, RequestContext context, SessionCreationOptions options) {
        SessionCreationOptions resolved = options != null ? options : SessionCreationOptions.defaults();
        Instant now = clock.instant();
        Duration maxAge = resolveMaxAge(resolved);
        LoginType loginType = resolved.getLoginType() != null ? resolved.getLoginType() : LoginType.PASSWORD;

        Session session = Session.builder()
                .sessionId(tokenGenerator.newSessionId())
                .userId(userId)
                .ipAddress(context != null ? context.getIp() : null)
                .userAgent(context != null ? context.getUserAgent() : null)
                .deviceFingerprint(context != null ? context.getDeviceFingerprint() : null)
                .createdAt(now)
                .lastActivity(now)
                .expiresAt(now.plus(maxAge))
                .maxAgeMillis(maxAge.toMillis())
                .loginType(loginType)
                .securityLevel(resolved.getSecurityLevel() != null
                        ? resolved.getSecurityLevel()
                        : loginType.getDefaultSecurityLevel())
                .rememberMe(resolved.isRememberMe())
                .build();

        return sessionStore.save(session, storageTtl(maxAge))
                .onErrorMap(e -> {
                    log.error("Failed to store session for user {}: {}", userId, e.getMessage(), e);
                    return new SessionException("Failed to create session", e);
                })
                .then(Mono.fromRunnable(() -> auditLogService.logSessionTransition(
                        SessionState.CREATED, session.getSessionId(), userId, loginType.getValue())))
                .then(resolved.isRememberMe()
                        ? issueRememberMeToken(session, resolved.getRememberMeLineage())
                        : Mono.just(new SessionIssue(session, null)));
    }

    private Mono<SessionIssue> issueRememberMeToken(Session session, String lineage) {
        Instant now = clock.instant();
        String rawToken = tokenGenerator.newRememberMeToken(session.getSessionId(), now);

        RememberMeToken token = RememberMeToken.builder()
                .tokenHash(tokenGenerator.hashToken(rawToken))
                .userId(session.getUserId())
                .lineageId(StringUtils.hasText(lineage) ? lineage : UUID.randomUUID().toString())
                .sessionId(session.getSessionId())
                .deviceFingerprint(session.getDeviceFingerprint())
                .createdAt(now)
                .expiresAt(now.plus(properties.getRememberMeTokenTtl()))
                .build();

        return rememberMeTokenStore.save(token, storageTtl(properties.getRememberMeTokenTtl()))
                .thenReturn(new SessionIssue(session, rawToken))
                .onErrorResume(e -> {
                    log.warn("Remember-me token not stored for user {}, continuing without it: {}",
                            session.getUserId(), e.getMessage());
                    auditLogService.logFailOpen("remember_me_write", session.getUserId(), e);
                    return Mono.just(new SessionIssue(session, null));
                });
    }

    private Duration resolveMaxAge(SessionCreationOptions options) {
        Duration requested = options.getMaxAge();
        if (requested == null) {
            return options.isRememberMe() ? properties.getRememberMeMaxAge() : properties.getDefaultMaxAge();
        }
        return clampMaxAge(requested);
    }

    private Duration storageTtl(Duration lifetime) {
        return lifetime.plus(properties.getExpiredRetention());
    }

    private Duration clampMaxAge(Duration requested) {
        if (requested.compareTo(properties.getMinMaxAge()) < 0) {
            return properties.getMinMaxAge();
        }
        if (requested.compareTo(properties.getMaxMaxAge()) > 0) {
            return properties.getMaxMaxAge();
        }
        return requested;
    }

    /* =========================
       Validation
       ========================= */

    /**
     * Resolves a session id to a valid session or a reason. A store failure
     * yields {@code store_unavailable}, never a valid result.
     */
    public Mono<SessionValidationResult> validateSession(String sessionId, RequestContext context) {
        if (!StringUtils.hasText(sessionId)) {
            return Mono.just(SessionValidationResult.invalid(SessionInvalidReason.MISSING));
        }

        return sessionStore.find(sessionId)
                .flatMap(session -> checkSession(session, context))
                .defaultIfEmpty(SessionValidationResult.invalid(SessionInvalidReason.NOT_FOUND))
                .onErrorResume(e -> {
                    log.error("Session lookup failed for {}: {}", AuditLogService.abbreviate(sessionId), e.getMessage());
                    auditLogService.logSystemEvent("SESSION_STORE_UNAVAILABLE", e.getMessage());
                    return Mono.just(SessionValidationResult.invalid(SessionInvalidReason.STORE_UNAVAILABLE));
                });
    }

    private Mono<SessionValidationResult> checkSession(Session session, RequestContext context) {
        Instant now = clock.instant();

        if (session.isExpired(now)) {
            return sessionStore.delete(session.getSessionId(), session.getUserId())
                    .doOnNext(removed -> {
                        if (removed) {
                            auditLogService.logSessionTransition(SessionState.EXPIRED,
                                    session.getSessionId(), session.getUserId(), "ttl");
                        }
                    })
                    .onErrorResume(e -> Mono.just(false))
                    .thenReturn(SessionValidationResult.invalid(SessionInvalidReason.EXPIRED));
        }

        if (fingerprintMismatch(session, context)) {
            FingerprintPolicy policy = properties.getFingerprintPolicy();
            if (policy != FingerprintPolicy.IGNORE) {
                auditLogService.logSecurityEvent("SESSION_DEVICE_MISMATCH", session.getUserId(), Map.of(
                        "sessionId", AuditLogService.abbreviate(session.getSessionId()),
                        "ip", HelperUtils.maskIpAddress(context.getIp()),
                        "policy", policy.name()));
            }
            if (policy == FingerprintPolicy.ENFORCE) {
                return Mono.just(SessionValidationResult.rejected(SessionInvalidReason.DEVICE_MISMATCH, session));
            }
        }

        if (!properties.isTrackActivity()) {
            return Mono.just(SessionValidationResult.valid(session));
        }

        Session touched = session.toBuilder().lastActivity(now).build();
        return sessionStore.update(touched, storageTtl(touched.remainingTtl(now)))
                .map(updated -> updated
                        ? SessionValidationResult.valid(touched)
                        : SessionValidationResult.invalid(SessionInvalidReason.NOT_FOUND))
                .onErrorResume(e -> {
                    log.warn("Activity update failed for session {}: {}",
                            AuditLogService.abbreviate(session.getSessionId()), e.getMessage());
                    return Mono.just(SessionValidationResult.valid(session));
                });
    }

    private boolean fingerprintMismatch(Session session, RequestContext context) {
        return context != null
                && StringUtils.hasText(session.getDeviceFingerprint())
                && StringUtils.hasText(context.getDeviceFingerprint())
                && !session.getDeviceFingerprint().equals(context.getDeviceFingerprint());
    }

    /* =========================
       Freshness & Security Level
       ========================= */

    /**
     * Narrows a valid result to sessions created within {@code maxAge}.
     * Measured from {@code createdAt}: activity tracking has already moved
     * {@code lastActivity} to now for the request being checked.
     */
    public SessionValidationResult requireFresh(SessionValidationResult result, Duration maxAge) {
        if (!result.isValid()) {
            return result;
        }
        Duration window = maxAge != null ? maxAge : properties.getFreshnessWindow();
        Instant createdAt = result.getSession().getCreatedAt();
        if (createdAt == null || createdAt.plus(window).isBefore(clock.instant())) {
            return SessionValidationResult.rejected(SessionInvalidReason.STALE, result.getSession());
        }
        return result;
    }

    /**
     * Narrows a valid result to sessions at or above {@code floor}.
     */
    public SessionValidationResult requireSecurityLevel(SessionValidationResult result, SecurityLevel floor) {
        if (!result.isValid()) {
            return result;
        }
        SecurityLevel current = result.getSession().getSecurityLevel();
        if (current == null || !current.isAtLeast(floor)) {
            return SessionValidationResult.rejected(SessionInvalidReason.INSUFFICIENT_SECURITY_LEVEL, result.getSession());
        }
        return result;
    }

    public Mono<Session> assertFresh(Session session) {
        SessionValidationResult result = requireFresh(SessionValidationResult.valid(session), properties.getFreshnessWindow());
        return result.isValid()
                ? Mono.just(session)
                : Mono.error(new InvalidSessionException(SessionInvalidReason.STALE));
    }

    public Mono<Session> assertSecurityLevel(Session session, SecurityLevel floor) {
        SessionValidationResult result = requireSecurityLevel(SessionValidationResult.valid(session), floor);
        return result.isValid()
                ? Mono.just(session)
                : Mono.error(new InsufficientSecurityLevelException(floor, session.getSecurityLevel()));
    }

    /* =========================
       Refresh & Rotation
       ========================= */

    /**
     * Extends the expiry of a live session. {@code maxAge} defaults to the
     * session's own max age.
     */
    public Mono<Session> refreshSession(String sessionId, Duration maxAge) {
        Instant now = clock.instant();

        return sessionStore.find(sessionId)
                .filter(session -> !session.isExpired(now))
                .switchIfEmpty(Mono.error(new InvalidSessionException(SessionInvalidReason.NOT_FOUND)))
                .flatMap(session -> {
                    Duration extension = maxAge != null
                            ? clampMaxAge(maxAge)
                            : Duration.ofMillis(session.getMaxAgeMillis());
                    Session refreshed = session.toBuilder()
                            .lastActivity(now)
                            .expiresAt(now.plus(extension))
                            .maxAgeMillis(extension.toMillis())
                            .build();

                    return sessionStore.update(refreshed, storageTtl(extension))
                            .flatMap(updated -> updated
                                    ? Mono.just(refreshed)
                                    : Mono.error(new InvalidSessionException(SessionInvalidReason.NOT_FOUND)));
                })
                .doOnNext(session -> log.debug("Session {} extended until {}",
                        AuditLogService.abbreviate(sessionId), session.getExpiresAt()));
    }

    /**
     * Issues a new id for the same session and destroys the old one.
     */
    public Mono<Session> rotateSession(String sessionId) {
        Instant now = clock.instant();

        return sessionStore.find(sessionId)
                .filter(session -> !session.isExpired(now))
                .switchIfEmpty(Mono.error(new InvalidSessionException(SessionInvalidReason.NOT_FOUND)))
                .flatMap(session -> {
                    Session rotated = session.toBuilder()
                            .sessionId(tokenGenerator.newSessionId())
                            .lastActivity(now)
                            .build();

                    return sessionStore.save(rotated, storageTtl(rotated.remainingTtl(now)))
                            .onErrorMap(e -> new SessionException("Failed to rotate session", e))
                            .then(destroySession(sessionId, "rotated"))
                            .doOnSuccess(v -> auditLogService.logSessionTransition(SessionState.CREATED,
                                    rotated.getSessionId(), rotated.getUserId(), "rotation"))
                            .thenReturn(rotated);
                });
    }

    /* =========================
       Remember-Me
       ========================= */

    /**
     * Trades a remember-me token for a new low-assurance session and a new
     * token of the same lineage. The old token is consumed atomically, so a
     * replayed token yields {@code not_found}. A token whose user is gone or
     * can no longer sign in is revoked with {@code account_inactive}.
     */
    public Mono<RememberMeRefreshResult> refreshFromRememberMeToken(String rawToken, RequestContext context) {
        if (!StringUtils.hasText(rawToken)) {
            return Mono.just(RememberMeRefreshResult.failure(SessionInvalidReason.MISSING.getValue()));
        }

        String tokenHash = tokenGenerator.hashToken(rawToken);
        Instant now = clock.instant();

        return rememberMeTokenStore.find(tokenHash)
                .flatMap(token -> {
                    if (token.isExpired(now)) {
                        return rememberMeTokenStore.delete(tokenHash, token.getUserId())
                                .thenReturn(RememberMeRefreshResult.failure(SessionInvalidReason.EXPIRED.getValue()));
                    }
                    if (tokenDeviceMismatch(token, context)) {
                        auditLogService.logSecurityEvent("REMEMBER_ME_DEVICE_MISMATCH", token.getUserId(), Map.of(
                                "lineage", token.getLineageId(),
                                "ip", HelperUtils.maskIpAddress(context.getIp())));
                        return rememberMeTokenStore.delete(tokenHash, token.getUserId())
                                .thenReturn(RememberMeRefreshResult.failure(SessionInvalidReason.DEVICE_MISMATCH.getValue()));
                    }
                    return userMayResume(token)
                            .flatMap(allowed -> allowed
                                    ? rememberMeTokenStore.consume(tokenHash)
                                            .flatMap(consumed -> mintFromToken(consumed, context))
                                            .defaultIfEmpty(RememberMeRefreshResult.failure(
                                                    SessionInvalidReason.NOT_FOUND.getValue()))
                                    : rememberMeTokenStore.delete(tokenHash, token.getUserId())
                                            .thenReturn(RememberMeRefreshResult.failure(
                                                    SessionInvalidReason.ACCOUNT_INACTIVE.getValue())));
                })
                .defaultIfEmpty(RememberMeRefreshResult.failure(SessionInvalidReason.NOT_FOUND.getValue()));
    }

    private Mono<Boolean> userMayResume(RememberMeToken token) {
        return userDirectory.findUserById(token.getUserId())
                .map(user -> user.canAuthenticate())
                .defaultIfEmpty(false)
                .doOnNext(allowed -> {
                    if (!allowed) {
                        auditLogService.logSecurityEvent("REMEMBER_ME_ACCOUNT_INACTIVE", token.getUserId(),
                                Map.of("lineage", token.getLineageId()));
                    }
                })
                .onErrorMap(e -> !(e instanceof CustomException), AuthServiceUnavailableException::new);
    }

    private Mono<RememberMeRefreshResult> mintFromToken(RememberMeToken token, RequestContext context) {
        SessionCreationOptions options = SessionCreationOptions.builder()
                .loginType(LoginType.REMEMBER_ME)
                .rememberMe(true)
                .rememberMeLineage(token.getLineageId())
                .build();

        return createSession(token.getUserId(), context, options)
                .map(issue -> RememberMeRefreshResult.success(issue.getSession(), issue.getRememberMeToken()))
                .doOnNext(result -> auditLogService.logSecurityEvent("REMEMBER_ME_REFRESH", token.getUserId(),
                        Map.of("lineage", token.getLineageId())));
    }

    private boolean tokenDeviceMismatch(RememberMeToken token, RequestContext context) {
        return properties.getFingerprintPolicy() == FingerprintPolicy.ENFORCE
                && context != null
                && StringUtils.hasText(token.getDeviceFingerprint())
                && StringUtils.hasText(context.getDeviceFingerprint())
                && !token.getDeviceFingerprint().equals(context.getDeviceFingerprint());
    }

    /**
     * Revokes the token presented in a cookie, e.g. on logout.
     */
    public Mono<Boolean> revokeRememberMeToken(String rawToken) {
        if (!StringUtils.hasText(rawToken)) {
            return Mono.just(false);
        }
        String tokenHash = tokenGenerator.hashToken(rawToken);
        return rememberMeTokenStore.find(tokenHash)
                .flatMap(token -> rememberMeTokenStore.delete(tokenHash, token.getUserId()))
                .defaultIfEmpty(false);
    }

    /* =========================
       Destruction
       ========================= */

    /**
     * Idempotent. Emits true only for the call that removed the record.
     */
    public Mono<Boolean> destroySession(String sessionId, String reason) {
        if (!StringUtils.hasText(sessionId)) {
            return Mono.just(false);
        }

        return sessionStore.find(sessionId)
                .flatMap(session -> sessionStore.delete(sessionId, session.getUserId())
                        .doOnNext(removed -> {
                            if (removed) {
                                auditLogService.logSessionTransition(
                                        SessionState.DESTROYED, sessionId, session.getUserId(), reason);
                            }
                        }))
                .defaultIfEmpty(false);
    }

    /**
     * Destroys every session of the user except {@code exceptSessionId}
     * and revokes remember-me tokens not minted with the kept session.
     */
    public Mono<Long> destroyAllUserSessions(String userId, String exceptSessionId, String reason) {
        Mono<Long> sessions = sessionStore.findSessionIds(userId)
                .filter(id -> !Objects.equals(id, exceptSessionId))
                .flatMap(id -> sessionStore.delete(id, userId)
                        .doOnNext(removed -> {
                            if (removed) {
                                auditLogService.logSessionTransition(SessionState.DESTROYED, id, userId, reason);
                            }
                        }))
                .filter(Boolean::booleanValue)
                .count();

        Mono<Long> tokens = rememberMeTokenStore.findByUser(userId)
                .filter(token -> exceptSessionId == null || !exceptSessionId.equals(token.getSessionId()))
                .flatMap(token -> rememberMeTokenStore.delete(token.getTokenHash(), userId))
                .filter(Boolean::booleanValue)
                .count();

        return Mono.zip(sessions, tokens)
                .doOnNext(counts -> log.info("Destroyed {} sessions and {} remember-me tokens for user {}",
                        counts.getT1(), counts.getT2(), userId))
                .map(counts -> counts.getT1());
    }

    /* =========================
       Queries
       ========================= */

    /**
     * Live sessions of the user, newest first.
     */
    public Flux<Session> getUserSessions(String userId) {
        Instant now = clock.instant();
        return sessionStore.findSessionIds(userId)
                .flatMap(sessionStore::find)
                .filter(session -> !session.isExpired(now))
                .sort(Comparator.comparing(Session::getCreatedAt).reversed());
    }

    public Mono<SessionStats> getSessionStats() {
        Instant now = clock.instant();

        return sessionStore.findAll()
                .filter(session -> !session.isExpired(now))
                .collectList()
                .map(sessions -> {
                    Map<String, Long> byLoginType = new TreeMap<>();
                    Map<String, Long> bySecurityLevel = new TreeMap<>();
                    long rememberMe = 0;

                    for (Session session : sessions) {
                        if (session.getLoginType() != null) {
                            byLoginType.merge(session.getLoginType().getValue(), 1L, Long::sum);
                        }
                        if (session.getSecurityLevel() != null) {
                            bySecurityLevel.merge(session.getSecurityLevel().getValue(), 1L, Long::sum);
                        }
                        if (session.isRememberMe()) {
                            rememberMe++;
                        }
                    }

                    return SessionStats.builder()
                            .activeSessions(sessions.size())
                            .rememberMeSessions(rememberMe)
                            .byLoginType(byLoginType)
                            .bySecurityLevel(bySecurityLevel)
                            .generatedAt(now)
                            .build();
                });
    }

    /* =========================
       Maintenance
       ========================= */

    /**
     * Prunes index entries whose record is gone. Records themselves leave
     * through key TTLs once {@code expiredRetention} has passed.
     */
    public Mono<Long> cleanupExpiredSessions() {
        return Mono.zip(sessionStore.pruneIndexes(), rememberMeTokenStore.pruneIndexes())
                .map(pruned -> pruned.getT1() + pruned.getT2())
                .doOnNext(total -> log.info("Session index cleanup pruned {} entries", total));
    }
}
