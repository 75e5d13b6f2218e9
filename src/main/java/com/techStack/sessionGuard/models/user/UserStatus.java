package com.techStack.sessionGuard.models.user;

import com.fasterxml.jackson.annotation.JsonCreator;
import lombok.Getter;

import java.util.Arrays;

/**
 * User Account Status
 *
 * Status reported by the storefront user directory. Only ACTIVE accounts may
 * open sessions.
 */
@Getter
public enum UserStatus {

    ACTIVE("Active", true),
    PENDING("Pending verification", false),
    SUSPENDED("Suspended by an administrator", false),
    LOCKED("Locked for security reasons", false),
    DISABLED("Permanently disabled", false);

    private final String description;
    private final boolean canAuthenticate;

    UserStatus(String description, boolean canAuthenticate) {
        this.description = description;
        this.canAuthenticate = canAuthenticate;
    }

    @JsonCreator
    public static UserStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        return Arrays.stream(values())
                .filter(status -> status.name().equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElse(DISABLED);
    }
}
