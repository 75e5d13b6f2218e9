package com.techStack.sessionGuard.dto.internal;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class LoginGateRequest {
    String identifier;
    String captchaToken;
    RequestContext requestContext;
}
