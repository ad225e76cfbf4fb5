package com.recipick.catalog.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.recipick.catalog.dto.CatalogSummaryResponse;
import com.recipick.catalog.entity.MaterialMappingEntity;
import com.recipick.catalog.entity.RecipeEntity;
import com.recipick.catalog.model.Recipe;
import com.recipick.catalog.model.RequiredMaterials;
import com.recipick.catalog.repository.MaterialMappingRepository;
import com.recipick.catalog.repository.RecipeRepository;
import com.recipick.matching.MaterialNormalizer;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class RecipeCatalog {

    private static final Logger log = LoggerFactory.getLogger(RecipeCatalog.class);

    private final RecipeRepository recipeRepository;
    private final MaterialMappingRepository materialMappingRepository;
    private final CatalogSeeder catalogSeeder;
    private final ObjectMapper objectMapper;
    private final CatalogProperties properties;
    private final Object loadLock = new Object();

    private volatile CatalogSnapshot snapshot;

    // guarded by loadLock
    private long lastFailureNanos;
    private boolean failed;

    public RecipeCatalog(
        RecipeRepository recipeRepository,
        MaterialMappingRepository materialMappingRepository,
        CatalogSeeder catalogSeeder,
        ObjectMapper objectMapper,
        CatalogProperties properties
    ) {
        this.recipeRepository = recipeRepository;
        this.materialMappingRepository = materialMappingRepository;
        this.catalogSeeder = catalogSeeder;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public void load() {
        if (snapshot != null) {
            return;
        }

        synchronized (loadLock) {
            if (snapshot != null || withinRetryInterval()) {
                return;
            }

            CatalogSnapshot loaded = loadFromStorage();
            if (loaded == null) {
                failed = true;
                lastFailureNanos = System.nanoTime();
            } else {
                failed = false;
                snapshot = loaded;
                log.info(
                    "Catalog loaded into memory (recipes={}, mappings={})",
                    loaded.recipes().size(),
                    loaded.mapping().size()
                );
            }
        }
    }

    /**
     * Loads if needed and returns the catalog to use for one whole request.
     */
    public CatalogSnapshot snapshot() {
        load();
        return current();
    }

    public boolean isLoaded() {
        return snapshot != null;
    }

    public CatalogSummaryResponse summary() {
        CatalogSnapshot view = snapshot();
        return new CatalogSummaryResponse(
            isLoaded(),
            view.recipes().size(),
            view.mapping().size(),
            new HashSet<>(view.mapping().values()).size()
        );
    }

    private boolean withinRetryInterval() {
        if (!failed) {
            return false;
        }
        long elapsedMs = (System.nanoTime() - lastFailureNanos) / 1_000_000L;
        return elapsedMs < properties.getRetryIntervalMs();
    }

    private CatalogSnapshot current() {
        CatalogSnapshot view = snapshot;
        return view == null ? CatalogSnapshot.EMPTY : view;
    }

    private CatalogSnapshot loadFromStorage() {
        try {
            if (catalogSeeder.seedIfEmpty()) {
                log.info("Catalog storage was empty and has been seeded");
            }
            CatalogSnapshot loaded = readStorage();
            if (!loaded.isEmpty()) {
                return loaded;
            }
            log.warn("Catalog storage has no usable recipes or mappings, reinitializing");
        } catch (RuntimeException exception) {
            log.error("Catalog storage could not be read, reinitializing: {}", exception.getMessage());
        }

        try {
            catalogSeeder.reseed();
            CatalogSnapshot loaded = readStorage();
            if (loaded.isEmpty()) {
                log.error("Catalog is still empty after reinitialization; no recommendations can be made");
            }
            return loaded;
        } catch (RuntimeException exception) {
            log.error("Catalog reinitialization failed; serving an empty catalog", exception);
            return null;
        }
    }

    private CatalogSnapshot readStorage() {
        List<Recipe> recipes = new ArrayList<>();
        for (RecipeEntity entity : recipeRepository.findAllByOrderByIdAsc()) {
            try {
                RequiredMaterials required = RequiredMaterials.fromJson(objectMapper.readTree(entity.getRequiredMaterials()));
                recipes.add(new Recipe(entity.getId(), entity.getName(), required, entity.getSteps(), entity.getImageUrl()));
            } catch (JsonProcessingException | IllegalArgumentException exception) {
                log.warn("Recipe '{}' skipped: unreadable required materials ({})", entity.getName(), exception.getMessage());
            }
        }

        Map<String, String> mapping = new LinkedHashMap<>();
        for (MaterialMappingEntity entity : materialMappingRepository.findAllByOrderByIdAsc()) {
            mapping.putIfAbsent(entity.getReceiptItem(), entity.getStandardMaterial());
        }

        return new CatalogSnapshot(recipes, mapping, MaterialNormalizer.build(mapping));
    }
}
