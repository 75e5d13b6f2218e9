package com.techStack.sessionGuard.security.authentication;

import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.AuthorityUtils;

/**
 * Back-end caller that presented the configured service token. Holds no
 * session level, so it only reaches routes that ask for {@link #TRUSTED_CALLER}.
 */
public class TrustedCallerAuthenticationToken extends AbstractAuthenticationToken {

    public static final String TRUSTED_CALLER = "ROLE_TRUSTED_CALLER";

    public TrustedCallerAuthenticationToken() {
        super(AuthorityUtils.createAuthorityList(TRUSTED_CALLER));
        setAuthenticated(true);
    }

    @Override
    public Object getCredentials() {
        return "";
    }

    @Override
    public Object getPrincipal() {
        return "trusted-caller";
    }
}
