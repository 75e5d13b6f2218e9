package com.techStack.sessionGuard.dto.internal;

import lombok.Builder;
import lombok.Value;

/**
 * Transport facts about the caller, resolved once per request.
 */
@Value
@Builder(toBuilder = true)
public class RequestContext {
    String ip;
    String userAgent;
    String deviceFingerprint;
    String path;
}
