package com.techStack.sessionGuard.models.user;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * User identity as returned by the storefront user directory.
 */
@Value
@Builder
@Jacksonized
public class UserAccount {
    String id;
    String identifier;
    String passwordHash;
    boolean active;
    UserStatus status;

    public boolean canAuthenticate() {
        return active && (status == null || status.isCanAuthenticate());
    }
}
