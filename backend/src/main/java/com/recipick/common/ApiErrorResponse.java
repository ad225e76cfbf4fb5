package com.recipick.common;

import java.time.Instant;

public record ApiErrorResponse(
    String status,
    String message,
    Instant timestamp,
    String path
) {

    public static ApiErrorResponse of(String message, String path) {
        return new ApiErrorResponse("error", message, Instant.now(), path);
    }
}
