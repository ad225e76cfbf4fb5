package com.recipick.ocr;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "ocr")
public class OcrProperties {

    private boolean enabled = true;

    private String baseUrl = "https://vision.googleapis.com";

    /**
     * Google Cloud Vision API key (VISION_API_KEY)
     */
    private String apiKey = "";

    private int connectTimeoutMs = 4000;

    private int readTimeoutMs = 15000;
}
