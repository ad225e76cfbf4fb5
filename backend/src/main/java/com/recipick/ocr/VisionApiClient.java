package com.recipick.ocr;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;

/**
 * Text detection through the Google Cloud Vision {@code images:annotate} REST endpoint.
 */
@Component
public class VisionApiClient implements TextExtractor {

    private static final Logger log = LoggerFactory.getLogger(VisionApiClient.class);

    private final OcrProperties properties;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    public VisionApiClient(OcrProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofMillis(Math.max(properties.getConnectTimeoutMs(), 1000)))
            .build();
    }

    @Override
    public boolean isAvailable() {
        return properties.isEnabled() && !safe(properties.getApiKey()).isBlank();
    }

    @Override
    public List<String> extractLines(byte[] image) {
        if (!isAvailable()) {
            throw new ResponseStatusException(
                HttpStatus.BAD_REQUEST,
                "Vision API is not configured on the server (VISION_API_KEY)"
            );
        }
        if (image == null || image.length == 0) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Uploaded image is empty");
        }

        HttpRequest request = HttpRequest.newBuilder(buildUri())
            .POST(HttpRequest.BodyPublishers.ofString(buildRequestBody(image), StandardCharsets.UTF_8))
            .timeout(Duration.ofMillis(Math.max(properties.getReadTimeoutMs(), 3000)))
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .header("User-Agent", "recipick-backend/1.0")
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException exception) {
            throw new ResponseStatusException(HttpStatus.GATEWAY_TIMEOUT, "Vision API did not respond in time", exception);
        } catch (IOException | InterruptedException exception) {
            if (exception instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new ResponseStatusException(
                HttpStatus.BAD_GATEWAY,
                "Failed to call Vision API: " + exception.getMessage(),
                exception
            );
        }

        if (response.statusCode() != 200) {
            log.warn("Vision API returned status {}: {}", response.statusCode(), abbreviate(response.body()));
            throw new ResponseStatusException(
                HttpStatus.BAD_GATEWAY,
                "Vision API returned status " + response.statusCode()
            );
        }

        List<String> lines = parseLines(response.body());
        log.info("Vision API detected {} text lines", lines.size());
        log.debug("Vision API text:\n{}", String.join("\n", lines));
        return lines;
    }

    List<String> parseLines(String body) {
        if (body == null || body.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_GATEWAY, "Vision API returned empty body");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException exception) {
            throw new ResponseStatusException(HttpStatus.BAD_GATEWAY, "Failed to parse Vision API response", exception);
        }

        JsonNode first = root.path("responses").path(0);
        String errorMessage = safe(first.path("error").path("message").asText(""));
        if (!errorMessage.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_GATEWAY, "Vision API error: " + errorMessage);
        }

        String fullText = first.path("textAnnotations").path(0).path("description").asText("");
        return Arrays.stream(fullText.split("\n"))
            .map(String::trim)
            .filter(line -> !line.isEmpty())
            .toList();
    }

    private String buildRequestBody(byte[] image) {
        ObjectNode root = objectMapper.createObjectNode();
        ObjectNode entry = root.putArray("requests").addObject();
        entry.putObject("image").put("content", Base64.getEncoder().encodeToString(image));
        entry.putArray("features").addObject().put("type", "TEXT_DETECTION");
        return root.toString();
    }

    private URI buildUri() {
        String normalizedBase = safe(properties.getBaseUrl());
        if (normalizedBase.endsWith("/")) {
            normalizedBase = normalizedBase.substring(0, normalizedBase.length() - 1);
        }
        String key = URLEncoder.encode(safe(properties.getApiKey()), StandardCharsets.UTF_8);
        return URI.create(normalizedBase + "/v1/images:annotate?key=" + key);
    }

    private String abbreviate(String value) {
        String normalized = safe(value);
        return normalized.length() <= 300 ? normalized : normalized.substring(0, 300) + "...";
    }

    private String safe(String value) {
        return value == null ? "" : value.trim();
    }
}
