package com.techStack.sessionGuard.exception.session;

import com.techStack.sessionGuard.exception.service.CustomException;
import com.techStack.sessionGuard.models.session.SessionInvalidReason;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class InvalidSessionException extends CustomException {
    private final SessionInvalidReason reason;

    public InvalidSessionException(SessionInvalidReason reason) {
        super(HttpStatus.UNAUTHORIZED, reason.getMessage(), codeFor(reason));
        this.reason = reason;
    }

    private static String codeFor(SessionInvalidReason reason) {
        return switch (reason) {
            case MISSING -> "SESSION_REQUIRED";
            case STALE -> "SESSION_STALE";
            default -> "SESSION_INVALID";
        };
    }
}
