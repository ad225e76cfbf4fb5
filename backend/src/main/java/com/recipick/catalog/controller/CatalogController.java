package com.recipick.catalog.controller;

import com.recipick.catalog.dto.CatalogSummaryResponse;
import com.recipick.catalog.service.RecipeCatalog;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/catalog")
public class CatalogController {

    private final RecipeCatalog recipeCatalog;

    public CatalogController(RecipeCatalog recipeCatalog) {
        this.recipeCatalog = recipeCatalog;
    }

    @GetMapping("/summary")
    public CatalogSummaryResponse getSummary() {
        return recipeCatalog.summary();
    }
}
