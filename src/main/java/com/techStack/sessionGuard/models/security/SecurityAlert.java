package com.techStack.sessionGuard.models.security;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class SecurityAlert {
    String type;
    String subject;
    SubjectType subjectType;
    Instant occurredAt;
    Map<String, Object> details;
}
