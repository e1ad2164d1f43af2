package github.sarthakdev143.scene_composer.integration.pexels;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import github.sarthakdev143.scene_composer.composition.KeywordExtractor;
import github.sarthakdev143.scene_composer.config.SceneComposerProperties;
import github.sarthakdev143.scene_composer.model.Asset;
import github.sarthakdev143.scene_composer.model.AssetKind;
import github.sarthakdev143.scene_composer.service.AssetSearchException;
import github.sarthakdev143.scene_composer.service.AssetSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Stock photo and video search against the Pexels REST API.
 *
 * <p>Pexels has no tag field, so tags are taken from the photo alt text and the slug of the Pexels
 * page URL. The search terms are not copied into the tags, since every result would then match
 * the section that searched for it. Rating and usage are unknown and left empty.
 */
@Component
@ConditionalOnProperty(name = "scene-composer.pexels.enabled", havingValue = "true")
public class PexelsAssetSource implements AssetSource {

    private static final Logger logger = LoggerFactory.getLogger(PexelsAssetSource.class);
    private static final String PHOTO_ID_PREFIX = "pexels-photo-";
    private static final String VIDEO_ID_PREFIX = "pexels-video-";
    private static final int MAX_QUERY_TERMS = 3;
    private static final int MAX_DERIVED_TAGS = 12;
    private static final int PREFERRED_VIDEO_WIDTH = 1920;

    private final SceneComposerProperties.Pexels properties;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    public PexelsAssetSource(SceneComposerProperties properties, ObjectMapper objectMapper) {
        this(
                properties.pexels(),
                objectMapper,
                HttpClient.newBuilder()
                        .connectTimeout(Duration.ofSeconds(properties.pexels().timeoutSeconds()))
                        .build());
    }

    PexelsAssetSource(SceneComposerProperties.Pexels properties, ObjectMapper objectMapper, HttpClient httpClient) {
        if (properties.apiKey() == null || properties.apiKey().isBlank()) {
            throw new IllegalStateException("scene-composer.pexels.api-key is required when Pexels search is enabled.");
        }
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.httpClient = httpClient;
        logger.info("Initialized Pexels asset source: baseUrl={} perPage={}", properties.baseUrl(), properties.perPage());
    }

    @Override
    public String name() {
        return "pexels";
    }

    @Override
    public List<Asset> search(List<String> queryTerms, AssetKind preferredKind) {
        if (queryTerms == null || queryTerms.isEmpty()) {
            return List.of();
        }
        List<String> terms = queryTerms.subList(0, Math.min(queryTerms.size(), MAX_QUERY_TERMS));
        String query = URLEncoder.encode(String.join(" ", terms), StandardCharsets.UTF_8);

        if (preferredKind == AssetKind.VIDEO) {
            JsonNode body = get("/videos/search?query=" + query + "&per_page=" + properties.perPage());
            return parseVideos(body);
        }
        JsonNode body = get("/v1/search?query=" + query + "&per_page=" + properties.perPage());
        return parsePhotos(body);
    }

    @Override
    public Optional<Asset> findById(String assetId) {
        if (assetId == null) {
            return Optional.empty();
        }
        if (assetId.startsWith(PHOTO_ID_PREFIX)) {
            JsonNode photo = get("/v1/photos/" + numericSuffix(assetId, PHOTO_ID_PREFIX));
            return Optional.ofNullable(toPhotoAsset(photo));
        }
        if (assetId.startsWith(VIDEO_ID_PREFIX)) {
            JsonNode video = get("/videos/videos/" + numericSuffix(assetId, VIDEO_ID_PREFIX));
            return Optional.ofNullable(toVideoAsset(video));
        }
        return Optional.empty();
    }

    List<Asset> parsePhotos(JsonNode body) {
        List<Asset> assets = new ArrayList<>();
        for (JsonNode photo : body.path("photos")) {
            Asset asset = toPhotoAsset(photo);
            if (asset != null) {
                assets.add(asset);
            }
        }
        return assets;
    }

    List<Asset> parseVideos(JsonNode body) {
        List<Asset> assets = new ArrayList<>();
        for (JsonNode video : body.path("videos")) {
            Asset asset = toVideoAsset(video);
            if (asset != null) {
                assets.add(asset);
            }
        }
        return assets;
    }

    private Asset toPhotoAsset(JsonNode photo) {
        String id = photo.path("id").asText("");
        String location = photo.path("src").path("large2x").asText(photo.path("src").path("original").asText(""));
        if (id.isBlank() || location.isBlank()) {
            return null;
        }
        String alt = photo.path("alt").asText("");
        return new Asset(
                PHOTO_ID_PREFIX + id,
                AssetKind.IMAGE,
                deriveTags(alt, photo.path("url").asText("")),
                null,
                0,
                location,
                alt.isBlank() ? null : alt);
    }

    private Asset toVideoAsset(JsonNode video) {
        String id = video.path("id").asText("");
        String location = selectVideoFile(video.path("video_files"));
        if (id.isBlank() || location == null) {
            return null;
        }
        return new Asset(
                VIDEO_ID_PREFIX + id,
                AssetKind.VIDEO,
                deriveTags("", video.path("url").asText("")),
                null,
                0,
                location,
                null);
    }

    /**
     * Full-HD file when available, otherwise the first listed file.
     */
    private String selectVideoFile(JsonNode videoFiles) {
        String fallback = null;
        for (JsonNode file : videoFiles) {
            String link = file.path("link").asText("");
            if (link.isBlank()) {
                continue;
            }
            if ("hd".equals(file.path("quality").asText()) && file.path("width").asInt() == PREFERRED_VIDEO_WIDTH) {
                return link;
            }
            if (fallback == null) {
                fallback = link;
            }
        }
        return fallback;
    }

    private Set<String> deriveTags(String alt, String pageUrl) {
        return new LinkedHashSet<>(KeywordExtractor.keywords(MAX_DERIVED_TAGS, alt, slugOf(pageUrl)));
    }

    private String slugOf(String pageUrl) {
        String trimmed = pageUrl.endsWith("/") ? pageUrl.substring(0, pageUrl.length() - 1) : pageUrl;
        int lastSlash = trimmed.lastIndexOf('/');
        String slug = lastSlash >= 0 ? trimmed.substring(lastSlash + 1) : trimmed;
        return slug.replace('-', ' ').replaceAll("\\d+", " ");
    }

    private String numericSuffix(String assetId, String prefix) {
        String suffix = assetId.substring(prefix.length());
        if (!suffix.matches("\\d+")) {
            throw new IllegalArgumentException("Malformed Pexels asset id: " + assetId);
        }
        return suffix;
    }

    private JsonNode get(String pathAndQuery) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(properties.baseUrl() + pathAndQuery))
                .timeout(Duration.ofSeconds(properties.timeoutSeconds()))
                .header("Authorization", properties.apiKey())
                .GET()
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() == 429) {
                throw new AssetSearchException("Pexels rate limit reached.");
            }
            if (response.statusCode() != 200) {
                throw new AssetSearchException("Pexels API returned status " + response.statusCode() + ".");
            }
            return objectMapper.readTree(response.body());
        } catch (IOException e) {
            throw new AssetSearchException("Pexels request failed: " + request.uri().getPath(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssetSearchException("Pexels request interrupted.", e);
        }
    }
}
