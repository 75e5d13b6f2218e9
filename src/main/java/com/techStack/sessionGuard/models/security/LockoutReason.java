package com.techStack.sessionGuard.models.security;

import com.fasterxml.jackson.annotation.JsonValue;

public enum LockoutReason {

    TOO_MANY_ATTEMPTS("too_many_attempts"),
    SUSPICIOUS_PATTERN("suspicious_pattern"),
    MANUAL("manual");

    private final String value;

    LockoutReason(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
