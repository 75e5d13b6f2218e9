package com.techStack.sessionGuard.dto.internal;

import com.techStack.sessionGuard.models.security.SecurityContext;
import com.techStack.sessionGuard.models.session.SessionIssue;
import com.techStack.sessionGuard.models.user.UserAccount;
import lombok.Value;

@Value
public class LoginResult {
    UserAccount user;
    SessionIssue issue;
    SecurityContext securityContext;
}
