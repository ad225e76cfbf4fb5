package com.recipick.catalog.service;

import com.recipick.catalog.model.Recipe;
import com.recipick.matching.MaterialNormalizer;
import java.util.List;
import java.util.Map;

public record CatalogSnapshot(List<Recipe> recipes, Map<String, String> mapping, MaterialNormalizer normalizer) {

    static final CatalogSnapshot EMPTY = new CatalogSnapshot(List.of(), Map.of(), MaterialNormalizer.empty());

    public CatalogSnapshot {
        recipes = List.copyOf(recipes);
        mapping = Map.copyOf(mapping);
    }

    boolean isEmpty() {
        return recipes.isEmpty() || mapping.isEmpty();
    }
}
