package com.techStack.sessionGuard.repository.user;

import com.techStack.sessionGuard.models.user.UserAccount;
import reactor.core.publisher.Mono;

/**
 * User lookup against the storefront account store. Empty when no user matches.
 */
public interface UserDirectory {

    Mono<UserAccount> findUserByIdentifier(String identifier);

    Mono<UserAccount> findUserById(String id);
}
