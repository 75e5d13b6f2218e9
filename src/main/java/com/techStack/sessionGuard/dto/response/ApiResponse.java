package com.techStack.sessionGuard.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;

import java.time.Instant;

/**
 * Standardized API Response Wrapper
 *
 * Success envelope for every endpoint. Errors are rendered by the exception
 * handler. Timestamps come from the caller's Clock.
 *
 * @param <T> Type of the data in success response
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private final boolean success;
    private final String message;
    private final T data;
    private final Instant timestamp;
    private final Long timestampMillis;

    public ApiResponse(boolean success, String message, T data, Instant timestamp) {
        this.success = success;
        this.message = message;
        this.data = data;
        this.timestamp = timestamp;
        this.timestampMillis = timestamp.toEpochMilli();
    }

    /* =========================
       Factory Methods
       ========================= */

    public static <T> ApiResponse<T> success(String message, T data, Instant timestamp) {
        return new ApiResponse<>(true, message, data, timestamp);
    }

    public static ApiResponse<Void> success(String message, Instant timestamp) {
        return new ApiResponse<>(true, message, null, timestamp);
    }

    @Override
    public String toString() {
        return "ApiResponse{" +
                "success=" + success +
                ", message='" + message + '\'' +
                ", data=" + data +
                ", timestamp=" + timestamp +
                '}';
    }
}
