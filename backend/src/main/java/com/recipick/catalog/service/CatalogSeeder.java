package com.recipick.catalog.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.recipick.catalog.entity.MaterialMappingEntity;
import com.recipick.catalog.entity.RecipeEntity;
import com.recipick.catalog.repository.MaterialMappingRepository;
import com.recipick.catalog.repository.RecipeRepository;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class CatalogSeeder {

    private static final Logger log = LoggerFactory.getLogger(CatalogSeeder.class);

    static final String DEFAULT_IMAGE_URL = "default_image_url";
    static final String PLACEHOLDER_RECIPE_NAME = "샘플 김치찌개";
    static final String PLACEHOLDER_RECIPE_MATERIALS = "{\"core\":[\"김치\"],\"optional\":[\"두부\"]}";
    static final String PLACEHOLDER_RECEIPT_ITEM = "샘플김치";
    static final String PLACEHOLDER_MATERIAL = "김치";

    private final RecipeRepository recipeRepository;
    private final MaterialMappingRepository materialMappingRepository;
    private final CatalogProperties properties;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    public CatalogSeeder(
        RecipeRepository recipeRepository,
        MaterialMappingRepository materialMappingRepository,
        CatalogProperties properties,
        ResourceLoader resourceLoader,
        ObjectMapper objectMapper
    ) {
        this.recipeRepository = recipeRepository;
        this.materialMappingRepository = materialMappingRepository;
        this.properties = properties;
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
    }

    /**
     * @return true if either table was empty and seeding ran
     */
    @Transactional
    public boolean seedIfEmpty() {
        if (recipeRepository.count() > 0 && materialMappingRepository.count() > 0) {
            return false;
        }
        reseed();
        return true;
    }

    /**
     * Wipes both tables and seeds them again.
     */
    @Transactional
    public void reseed() {
        log.info("Catalog seeding started (recipes={}, mappings={})", properties.getRecipesSeed(), properties.getMappingsSeed());

        recipeRepository.deleteAllInBatch();
        materialMappingRepository.deleteAllInBatch();

        List<RecipeEntity> recipes = readRecipes();
        recipeRepository.saveAll(recipes);

        int inserted = 0;
        int duplicates = 0;
        for (MaterialMappingEntity mapping : readMappings()) {
            if (materialMappingRepository.existsByReceiptItem(mapping.getReceiptItem())) {
                duplicates++;
                continue;
            }
            materialMappingRepository.save(mapping);
            inserted++;
        }

        log.info(
            "Catalog seeding completed (recipes={}, mappings={}, duplicateMappingsIgnored={})",
            recipes.size(),
            inserted,
            duplicates
        );
    }

    private List<RecipeEntity> readRecipes() {
        JsonNode root = readSeed(properties.getRecipesSeed());
        if (root == null) {
            log.warn("Recipe seed unavailable, using placeholder recipe '{}'", PLACEHOLDER_RECIPE_NAME);
            return List.of(new RecipeEntity(PLACEHOLDER_RECIPE_NAME, PLACEHOLDER_RECIPE_MATERIALS, "", DEFAULT_IMAGE_URL));
        }

        List<RecipeEntity> rows = new ArrayList<>();
        int index = 0;
        for (JsonNode node : root) {
            index++;
            String name = text(node, "name");
            JsonNode materials = node.path("materials");
            if (name.isBlank() || materials.isMissingNode() || materials.isNull()) {
                log.warn("Recipe seed entry #{} skipped: name and materials are required", index);
                continue;
            }

            String steps = text(node, "steps");
            String imageUrl = text(node, "image_url");
            rows.add(new RecipeEntity(
                name,
                writeJson(materials),
                steps,
                imageUrl.isBlank() ? DEFAULT_IMAGE_URL : imageUrl
            ));
        }
        return rows;
    }

    private List<MaterialMappingEntity> readMappings() {
        JsonNode root = readSeed(properties.getMappingsSeed());
        if (root == null) {
            log.warn("Mapping seed unavailable, using placeholder mapping '{}' -> '{}'", PLACEHOLDER_RECEIPT_ITEM, PLACEHOLDER_MATERIAL);
            return List.of(new MaterialMappingEntity(PLACEHOLDER_RECEIPT_ITEM, PLACEHOLDER_MATERIAL));
        }

        List<MaterialMappingEntity> rows = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (JsonNode node : root) {
            String item = text(node, "item");
            String material = text(node, "material");
            if (item.isBlank() || material.isBlank()) {
                continue;
            }
            // first occurrence of a receipt item wins
            if (seen.add(item)) {
                rows.add(new MaterialMappingEntity(item, material));
            }
        }
        return rows;
    }

    private JsonNode readSeed(String location) {
        if (location == null || location.isBlank()) {
            return null;
        }

        Resource resource = resourceLoader.getResource(location.trim());
        if (!resource.exists()) {
            log.warn("Seed file {} does not exist", location);
            return null;
        }

        try (InputStream input = resource.getInputStream()) {
            JsonNode root = objectMapper.readTree(input);
            if (root == null || !root.isArray()) {
                log.error("Seed file {} must contain a JSON array", location);
                return null;
            }
            return root;
        } catch (IOException exception) {
            log.error("Seed file {} could not be read: {}", location, exception.getMessage());
            return null;
        }
    }

    private String writeJson(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException exception) {
            throw new IllegalStateException("Failed to serialize recipe materials", exception);
        }
    }

    private String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return "";
        }
        return value.asText("").trim();
    }
}
