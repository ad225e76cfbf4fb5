package com.recipick.recommendation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RecipeRecommendationResponse(
    String name,
    String imageUrl,
    int matchRatio,
    List<String> matchedMaterials,
    List<String> missingMaterials,
    int missingCount,
    String steps
) {
}
