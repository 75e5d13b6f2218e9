package com.techStack.sessionGuard.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionStatusResponse {
    boolean authenticated;
    String reason;
    SessionResponse session;
}
