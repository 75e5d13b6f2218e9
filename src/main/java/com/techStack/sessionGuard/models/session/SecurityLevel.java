package com.techStack.sessionGuard.models.session;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Ordered session assurance level: low &lt; standard &lt; high.
 */
public enum SecurityLevel {

    LOW("low"),
    STANDARD("standard"),
    HIGH("high");

    private final String value;

    SecurityLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isAtLeast(SecurityLevel floor) {
        return compareTo(floor) >= 0;
    }

    @JsonCreator
    public static SecurityLevel fromValue(String value) {
        return Arrays.stream(values())
                .filter(level -> level.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown security level: " + value));
    }
}
