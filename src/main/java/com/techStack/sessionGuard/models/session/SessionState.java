package com.techStack.sessionGuard.models.session;

/**
 * Session lifecycle: CREATED, then ACTIVE while revalidated, then EXPIRED or DESTROYED.
 *
 * Both terminal states look the same to clients. They are kept apart in the audit trail.
 */
public enum SessionState {
    CREATED,
    ACTIVE,
    EXPIRED,
    DESTROYED
}
