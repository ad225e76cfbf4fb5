package com.recipick.recommendation.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.recipick.common.GlobalExceptionHandler;
import com.recipick.recommendation.dto.ReceiptRecommendationResponse;
import com.recipick.recommendation.dto.RecipeRecommendationResponse;
import com.recipick.recommendation.service.ReceiptRecommendationService;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.server.ResponseStatusException;

@ExtendWith(MockitoExtension.class)
class RecommendationControllerTest {

    @Mock
    private ReceiptRecommendationService receiptRecommendationService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new RecommendationController(receiptRecommendationService))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }

    @Test
    void health_should_report_running_service() throws Exception {
        mockMvc.perform(get("/"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ok"))
            .andExpect(jsonPath("$.message").value("Recipe Recommender Service is running"));

        verify(receiptRecommendationService).warmUp();
    }

    @Test
    void recommend_should_render_snake_case_payload() throws Exception {
        when(receiptRecommendationService.recommendFromLines(List.of("종가집김치 1kg", "돼지목살")))
            .thenReturn(ReceiptRecommendationResponse.success(
                List.of("김치", "돼지고기"),
                null,
                List.of(new RecipeRecommendationResponse(
                    "김치찌개",
                    "default_image_url",
                    66,
                    List.of("김치", "돼지고기"),
                    List.of("두부"),
                    1,
                    "김치와 돼지고기를 볶는다"
                ))
            ));

        mockMvc.perform(post("/recommend")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"receipt_lines\": [\"종가집김치 1kg\", \"돼지목살\"]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("success"))
            .andExpect(jsonPath("$.standard_materials[0]").value("김치"))
            .andExpect(jsonPath("$.ocr_lines").doesNotExist())
            .andExpect(jsonPath("$.recommendations[0].name").value("김치찌개"))
            .andExpect(jsonPath("$.recommendations[0].image_url").value("default_image_url"))
            .andExpect(jsonPath("$.recommendations[0].match_ratio").value(66))
            .andExpect(jsonPath("$.recommendations[0].missing_materials[0]").value("두부"))
            .andExpect(jsonPath("$.recommendations[0].missing_count").value(1));
    }

    @Test
    void recommend_should_reject_body_without_receipt_lines() throws Exception {
        mockMvc.perform(post("/recommend")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.status").value("error"))
            .andExpect(jsonPath("$.path").value("/recommend"));

        verifyNoInteractions(receiptRecommendationService);
    }

    @Test
    void recommend_should_reject_malformed_json() throws Exception {
        mockMvc.perform(post("/recommend")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"receipt_lines\": "))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Request body is missing or malformed"));
    }

    @Test
    void recommend_should_accept_image_upload() throws Exception {
        MockMultipartFile image = new MockMultipartFile("image", "receipt.jpg", "image/jpeg", new byte[] {1, 2});
        when(receiptRecommendationService.recommendFromImage(any()))
            .thenReturn(ReceiptRecommendationResponse.success(List.of("두부"), List.of("풀무원두부"), List.of()));

        mockMvc.perform(multipart("/recommend").file(image))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.ocr_lines[0]").value("풀무원두부"))
            .andExpect(jsonPath("$.standard_materials[0]").value("두부"))
            .andExpect(jsonPath("$.recommendations").isEmpty());
    }

    @Test
    void recommend_should_map_service_failure_to_error_payload() throws Exception {
        MockMultipartFile image = new MockMultipartFile("image", "receipt.jpg", "image/jpeg", new byte[] {1});
        when(receiptRecommendationService.recommendFromImage(any()))
            .thenThrow(new ResponseStatusException(HttpStatus.GATEWAY_TIMEOUT, "Vision API timed out"));

        mockMvc.perform(multipart("/recommend").file(image))
            .andExpect(status().isGatewayTimeout())
            .andExpect(jsonPath("$.status").value("error"))
            .andExpect(jsonPath("$.message").value("Vision API timed out"));
    }

    @Test
    void recommend_should_propagate_unexpected_failure_as_internal_error() throws Exception {
        when(receiptRecommendationService.recommendFromLines(anyList()))
            .thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(post("/recommend")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"receipt_lines\": []}"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.message").value("Internal server error"));
    }
}
