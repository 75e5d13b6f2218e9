package com.techStack.sessionGuard.models.attempt;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.util.Arrays;

/**
 * Outcome of a single login attempt.
 *
 * Only failures count toward lockout, IP blocking, CAPTCHA and delay.
 * {@link #LOCKED} attempts are kept for velocity analysis.
 */
@Getter
public enum AttemptOutcome {

    SUCCESS("success", false),
    INVALID_CREDENTIALS("invalid_credentials", true),
    LOCKED("locked", false),
    SYSTEM_ERROR("system_error", true);

    private final String value;
    private final boolean failure;

    AttemptOutcome(String value, boolean failure) {
        this.value = value;
        this.failure = failure;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static AttemptOutcome fromValue(String value) {
        return Arrays.stream(values())
                .filter(outcome -> outcome.value.equalsIgnoreCase(value) || outcome.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown attempt outcome: " + value));
    }
}
