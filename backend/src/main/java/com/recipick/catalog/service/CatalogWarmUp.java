package com.recipick.catalog.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
public class CatalogWarmUp {

    private static final Logger log = LoggerFactory.getLogger(CatalogWarmUp.class);

    private final RecipeCatalog recipeCatalog;
    private final CatalogProperties properties;

    public CatalogWarmUp(RecipeCatalog recipeCatalog, CatalogProperties properties) {
        this.recipeCatalog = recipeCatalog;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void warmUpAtStartup() {
        if (!properties.isWarmUpOnStartup()) {
            log.info("Catalog warm-up skipped (warmUpOnStartup=false); loading on first request");
            return;
        }

        try {
            recipeCatalog.load();
        } catch (Exception exception) {
            log.warn("Catalog warm-up failed, will retry on first request: {}", exception.getMessage());
        }
    }
}
