package com.techStack.sessionGuard.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoginRequest {

    @NotBlank(message = "Identifier is required")
    @Size(max = 254, message = "Identifier is too long")
    private String identifier;

    @NotBlank(message = "Password is required")
    @Size(max = 128, message = "Password is too long")
    private String password;

    private boolean rememberMe;

    private String captchaToken;
}
