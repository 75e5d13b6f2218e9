package com.techStack.sessionGuard.models.session;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.util.Arrays;

@Getter
public enum SessionInvalidReason {

    MISSING("missing", "No session ID provided"),
    NOT_FOUND("not_found", "Session not found or expired"),
    EXPIRED("expired", "Session expired"),
    DEVICE_MISMATCH("device_mismatch", "Session was created on a different device"),
    STALE("stale", "Session is not fresh enough for this operation"),
    INSUFFICIENT_SECURITY_LEVEL("insufficient_security_level", "Session security level is too low"),
    STORE_UNAVAILABLE("store_unavailable", "Session could not be verified"),
    ACCOUNT_INACTIVE("account_inactive", "Account can no longer sign in");

    private final String value;
    private final String message;

    SessionInvalidReason(String value, String message) {
        this.value = value;
        this.message = message;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Unknown values map to NOT_FOUND.
     */
    public static SessionInvalidReason fromValue(String value) {
        return Arrays.stream(values())
                .filter(reason -> reason.value.equals(value))
                .findFirst()
                .orElse(NOT_FOUND);
    }
}
