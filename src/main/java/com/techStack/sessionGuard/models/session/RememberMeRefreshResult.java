package com.techStack.sessionGuard.models.session;

import lombok.Value;

@Value
public class RememberMeRefreshResult {

    boolean success;
    String reason;
    Session session;
    String rememberMeToken;

    public static RememberMeRefreshResult success(Session session, String rememberMeToken) {
        return new RememberMeRefreshResult(true, null, session, rememberMeToken);
    }

    public static RememberMeRefreshResult failure(String reason) {
        return new RememberMeRefreshResult(false, reason, null, null);
    }
}
