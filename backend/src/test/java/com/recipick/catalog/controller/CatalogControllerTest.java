package com.recipick.catalog.controller;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.recipick.catalog.dto.CatalogSummaryResponse;
import com.recipick.catalog.service.RecipeCatalog;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class CatalogControllerTest {

    @Mock
    private RecipeCatalog recipeCatalog;

    @Test
    void getSummary_should_expose_catalog_counts() throws Exception {
        when(recipeCatalog.summary()).thenReturn(new CatalogSummaryResponse(true, 12, 45, 30));
        MockMvc mockMvc = MockMvcBuilders.standaloneSetup(new CatalogController(recipeCatalog)).build();

        mockMvc.perform(get("/catalog/summary"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.loaded").value(true))
            .andExpect(jsonPath("$.recipes").value(12))
            .andExpect(jsonPath("$.mappings").value(45))
            .andExpect(jsonPath("$.standard_materials").value(30));
    }
}
