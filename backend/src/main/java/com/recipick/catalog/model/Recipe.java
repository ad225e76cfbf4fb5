package com.recipick.catalog.model;

import java.util.Objects;

public record Recipe(
    long id,
    String name,
    RequiredMaterials requiredMaterials,
    String steps,
    String imageUrl
) {

    public Recipe {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(requiredMaterials, "requiredMaterials");
    }
}
