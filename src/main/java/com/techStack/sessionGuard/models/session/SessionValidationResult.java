package com.techStack.sessionGuard.models.session;

import lombok.Value;

@Value
public class SessionValidationResult {

    boolean valid;
    SessionInvalidReason reason;
    Session session;

    public static SessionValidationResult valid(Session session) {
        return new SessionValidationResult(true, null, session);
    }

    public static SessionValidationResult invalid(SessionInvalidReason reason) {
        return new SessionValidationResult(false, reason, null);
    }

    /**
     * Invalid result that still carries the session, used by the freshness
     * and security-level filters so callers can report the current level.
     */
    public static SessionValidationResult rejected(SessionInvalidReason reason, Session session) {
        return new SessionValidationResult(false, reason, session);
    }
}
