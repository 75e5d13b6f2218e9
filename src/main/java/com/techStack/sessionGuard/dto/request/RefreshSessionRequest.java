package com.techStack.sessionGuard.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RefreshSessionRequest {

    @Min(value = 300_000L, message = "maxAge must be at least 5 minutes")
    @Max(value = 2_592_000_000L, message = "maxAge must be at most 30 days")
    private Long maxAge;
}
