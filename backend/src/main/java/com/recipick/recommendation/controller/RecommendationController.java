package com.recipick.recommendation.controller;

import com.recipick.recommendation.dto.HealthResponse;
import com.recipick.recommendation.dto.ReceiptRecommendationRequest;
import com.recipick.recommendation.dto.ReceiptRecommendationResponse;
import com.recipick.recommendation.service.ReceiptRecommendationService;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
public class RecommendationController {

    private final ReceiptRecommendationService receiptRecommendationService;

    public RecommendationController(ReceiptRecommendationService receiptRecommendationService) {
        this.receiptRecommendationService = receiptRecommendationService;
    }

    @GetMapping("/")
    public HealthResponse health() {
        receiptRecommendationService.warmUp();
        return new HealthResponse("ok", "Recipe Recommender Service is running");
    }

    @PostMapping(value = "/recommend", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ReceiptRecommendationResponse recommendFromLines(@Valid @RequestBody ReceiptRecommendationRequest request) {
        return receiptRecommendationService.recommendFromLines(request.receiptLines());
    }

    @PostMapping(value = "/recommend", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ReceiptRecommendationResponse recommendFromImage(@RequestPart("image") MultipartFile image) {
        return receiptRecommendationService.recommendFromImage(image);
    }
}
