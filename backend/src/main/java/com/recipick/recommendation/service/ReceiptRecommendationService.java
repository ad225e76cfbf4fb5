package com.recipick.recommendation.service;

import com.recipick.catalog.service.CatalogSnapshot;
import com.recipick.catalog.service.RecipeCatalog;
import com.recipick.ocr.TextExtractor;
import com.recipick.recommendation.dto.ReceiptRecommendationResponse;
import com.recipick.recommendation.dto.RecipeRecommendationResponse;
import java.io.IOException;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

/**
 * Receipt lines or a receipt image in, ranked recipes out.
 */
@Service
public class ReceiptRecommendationService {

    private static final Logger log = LoggerFactory.getLogger(ReceiptRecommendationService.class);

    private final RecipeCatalog recipeCatalog;
    private final RecommendationService recommendationService;
    private final TextExtractor textExtractor;
    private final RecommendationProperties properties;

    public ReceiptRecommendationService(
        RecipeCatalog recipeCatalog,
        RecommendationService recommendationService,
        TextExtractor textExtractor,
        RecommendationProperties properties
    ) {
        this.recipeCatalog = recipeCatalog;
        this.recommendationService = recommendationService;
        this.textExtractor = textExtractor;
        this.properties = properties;
    }

    public void warmUp() {
        recipeCatalog.load();
        if (!textExtractor.isAvailable()) {
            log.warn("Text extraction is not configured; image uploads will be rejected");
        }
    }

    public ReceiptRecommendationResponse recommendFromLines(List<String> receiptLines) {
        return recommend(receiptLines, null);
    }

    public ReceiptRecommendationResponse recommendFromImage(MultipartFile image) {
        if (!textExtractor.isAvailable()) {
            log.error("Image recommendation rejected: text extraction is not configured");
            throw new ResponseStatusException(
                HttpStatus.BAD_REQUEST,
                "Vision API is not configured on the server (VISION_API_KEY)"
            );
        }

        if (image == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Image file is missing");
        }
        if (image.getOriginalFilename() == null || image.getOriginalFilename().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "No file was selected");
        }
        if (image.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Uploaded image is empty");
        }

        byte[] content;
        try {
            content = image.getBytes();
        } catch (IOException exception) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Uploaded image could not be read", exception);
        }

        List<String> ocrLines = textExtractor.extractLines(content);
        if (ocrLines.isEmpty()) {
            log.warn("Text extraction returned no lines for '{}'", image.getOriginalFilename());
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "OCR result is empty");
        }

        return recommend(ocrLines, ocrLines);
    }

    private ReceiptRecommendationResponse recommend(List<String> receiptLines, List<String> ocrLines) {
        List<String> lines = receiptLines == null ? List.of() : receiptLines;
        CatalogSnapshot catalog = recipeCatalog.snapshot();
        Set<String> standardMaterials = catalog.normalizer().normalize(lines);
        log.info("Normalized {} receipt lines into materials {}", lines.size(), standardMaterials);

        List<RecipeRecommendationResponse> recommendations =
            recommendationService.recommend(catalog.recipes(), standardMaterials, properties.getTopN());

        return ReceiptRecommendationResponse.success(
            List.copyOf(standardMaterials),
            ocrLines == null ? null : List.copyOf(ocrLines),
            recommendations
        );
    }
}
