package com.techStack.sessionGuard.models.session;

import lombok.Value;

/**
 * A freshly created session and, when remember-me was requested and stored,
 * the raw token destined for the rememberMe cookie.
 */
@Value
public class SessionIssue {
    Session session;
    String rememberMeToken;

    public boolean hasRememberMeToken() {
        return rememberMeToken != null;
    }
}
