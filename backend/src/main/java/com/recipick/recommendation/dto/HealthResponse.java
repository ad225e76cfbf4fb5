package com.recipick.recommendation.dto;

public record HealthResponse(
    String status,
    String message
) {
}
