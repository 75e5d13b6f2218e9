package com.techStack.sessionGuard.security.authentication;

import com.techStack.sessionGuard.models.session.SecurityLevel;
import com.techStack.sessionGuard.models.session.Session;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

import java.util.ArrayList;
import java.util.List;

/**
 * Authenticated principal backed by a validated {@link Session}.
 *
 * A session is granted {@code LEVEL_x} for its own security level and every
 * level below it, so {@code hasAuthority("LEVEL_STANDARD")} admits high sessions.
 */
public class SessionAuthenticationToken extends AbstractAuthenticationToken {

    public static final String LEVEL_AUTHORITY_PREFIX = "LEVEL_";

    private final Session session;

    public SessionAuthenticationToken(Session session) {
        super(authoritiesFor(session.getSecurityLevel()));
        this.session = session;
        setAuthenticated(true);
    }

    @Override
    public Object getCredentials() {
        return session.getSessionId();
    }

    @Override
    public Session getPrincipal() {
        return session;
    }

    @Override
    public String getName() {
        return session.getUserId();
    }

    public static String authority(SecurityLevel level) {
        return LEVEL_AUTHORITY_PREFIX + level.name();
    }

    private static List<GrantedAuthority> authoritiesFor(SecurityLevel level) {
        List<GrantedAuthority> authorities = new ArrayList<>();
        SecurityLevel effective = level != null ? level : SecurityLevel.LOW;
        for (SecurityLevel candidate : SecurityLevel.values()) {
            if (effective.isAtLeast(candidate)) {
                authorities.add(new SimpleGrantedAuthority(authority(candidate)));
            }
        }
        return authorities;
    }
}
