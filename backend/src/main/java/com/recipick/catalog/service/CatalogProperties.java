package com.recipick.catalog.service;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "catalog")
public class CatalogProperties {

    /**
     * Spring resource location of the recipe seed array
     */
    private String recipesSeed = "classpath:seed/recipes.json";

    /**
     * Spring resource location of the receipt item mapping seed array
     */
    private String mappingsSeed = "classpath:seed/mappings.json";

    /**
     * Load the catalog once the application is ready instead of on the first request
     */
    private boolean warmUpOnStartup = true;

    /**
     * Minimum wait after a failed load before storage is read or reinitialized again
     */
    private long retryIntervalMs = 30000;
}
