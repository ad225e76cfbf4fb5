package com.recipick.recommendation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ReceiptRecommendationResponse(
    String status,
    List<String> standardMaterials,
    List<String> ocrLines,
    List<RecipeRecommendationResponse> recommendations
) {

    public static ReceiptRecommendationResponse success(
        List<String> standardMaterials,
        List<String> ocrLines,
        List<RecipeRecommendationResponse> recommendations
    ) {
        return new ReceiptRecommendationResponse("success", standardMaterials, ocrLines, recommendations);
    }
}
