package com.recipick.recommendation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record ReceiptRecommendationRequest(
    @NotNull
    @JsonProperty("receipt_lines")
    List<String> receiptLines
) {
}
