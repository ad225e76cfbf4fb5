package com.recipick.catalog.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CatalogSummaryResponse(
    boolean loaded,
    int recipes,
    int mappings,
    int standardMaterials
) {
}
