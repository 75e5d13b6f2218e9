package com.techStack.sessionGuard.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Session creation by a trusted caller that has already authenticated the user.
 * {@code maxAge} is in milliseconds, between 5 minutes and 30 days.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateSessionRequest {

    @NotBlank(message = "userId is required")
    private String userId;

    @Pattern(regexp = "password|social|otp", message = "loginType must be password, social or otp")
    private String loginType;

    private boolean rememberMe;

    @Min(value = 300_000L, message = "maxAge must be at least 5 minutes")
    @Max(value = 2_592_000_000L, message = "maxAge must be at most 30 days")
    private Long maxAge;

    @Pattern(regexp = "low|standard|high", message = "securityLevel must be low, standard or high")
    private String securityLevel;
}
