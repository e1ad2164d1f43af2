package github.sarthakdev143.scene_composer.integration.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import github.sarthakdev143.scene_composer.config.SceneComposerProperties;
import github.sarthakdev143.scene_composer.model.Emotion;
import github.sarthakdev143.scene_composer.model.Pace;
import github.sarthakdev143.scene_composer.model.SemanticAnalysis;
import github.sarthakdev143.scene_composer.service.SemanticAnalysisException;
import github.sarthakdev143.scene_composer.service.SemanticAnalysisService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Calls an external text-analysis endpoint: {@code POST {baseUrl}/analyze} with
 * {@code {"text": "..."}}, answered by {@code {"energy": 7.5, "emotion": "excitement",
 * "pace": "fast", "keywords": [...]}}. {@code intensity} is accepted as an alias of
 * {@code energy}. Unknown emotion or pace values are left empty.
 */
@Component
@ConditionalOnProperty(name = "scene-composer.analysis.enabled", havingValue = "true")
public class HttpSemanticAnalysisClient implements SemanticAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(HttpSemanticAnalysisClient.class);

    private final SceneComposerProperties.Analysis properties;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    public HttpSemanticAnalysisClient(SceneComposerProperties properties, ObjectMapper objectMapper) {
        this(
                properties.analysis(),
                objectMapper,
                HttpClient.newBuilder()
                        .connectTimeout(Duration.ofMillis(properties.analysis().timeoutMillis()))
                        .build());
    }

    HttpSemanticAnalysisClient(
            SceneComposerProperties.Analysis properties,
            ObjectMapper objectMapper,
            HttpClient httpClient) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.httpClient = httpClient;
        logger.info("Initialized semantic analysis client: baseUrl={}", properties.baseUrl());
    }

    @Override
    public SemanticAnalysis analyze(String text) {
        try {
            String body = objectMapper.writeValueAsString(Map.of("text", text == null ? "" : text));
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(properties.baseUrl() + "/analyze"))
                    .timeout(Duration.ofMillis(properties.timeoutMillis()))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new SemanticAnalysisException(
                        "Analysis service returned status " + response.statusCode() + ".");
            }
            return parse(objectMapper.readTree(response.body()));
        } catch (IOException e) {
            throw new SemanticAnalysisException("Analysis request failed.", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SemanticAnalysisException("Analysis request interrupted.", e);
        }
    }

    SemanticAnalysis parse(JsonNode node) {
        JsonNode energyNode = node.hasNonNull("energy") ? node.get("energy") : node.get("intensity");
        Double energy = energyNode != null && energyNode.isNumber() ? energyNode.asDouble() : null;

        List<String> keywords = new ArrayList<>();
        for (JsonNode keyword : node.path("keywords")) {
            if (keyword.isTextual() && !keyword.asText().isBlank()) {
                keywords.add(keyword.asText().trim());
            }
        }

        return new SemanticAnalysis(
                energy,
                Emotion.fromInput(node.path("emotion").asText(null)),
                Pace.fromInput(node.path("pace").asText(null)),
                keywords);
    }
}
