package github.sarthakdev143.scene_composer.config;

import github.sarthakdev143.scene_composer.model.AssetKind;
import github.sarthakdev143.scene_composer.model.OutputPreset;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Settings under the {@code scene-composer} prefix.
 */
@ConfigurationProperties(prefix = "scene-composer")
@Validated
public record SceneComposerProperties(
        @Valid @DefaultValue Composition composition,
        @Valid @DefaultValue Analysis analysis,
        @Valid @DefaultValue Catalog catalog,
        @Valid @DefaultValue Pexels pexels,
        @Valid @DefaultValue Render render) {

    /**
     * Defaults applied to every composition run unless a request overrides them.
     */
    public record Composition(
            @DefaultValue("30") @DecimalMin("0") @DecimalMax("100") double minimumScore,
            @DefaultValue("5") @Positive int candidateLimit,
            @DefaultValue("true") boolean strictKindMatching,
            String placeholderAssetId) {
    }

    public record Analysis(
            @DefaultValue("false") boolean enabled,
            @DefaultValue("http://localhost:8090") String baseUrl,
            @DefaultValue("3000") @Positive long timeoutMillis) {
    }

    public record Catalog(@DefaultValue List<@Valid CatalogAsset> assets) {

        public Catalog {
            assets = assets == null ? List.of() : List.copyOf(assets);
        }
    }

    public record CatalogAsset(
            @NotBlank String id,
            AssetKind kind,
            List<String> tags,
            Integer rating,
            @DefaultValue("0") int usageCount,
            String location,
            String description) {
    }

    public record Pexels(
            @DefaultValue("false") boolean enabled,
            String apiKey,
            @DefaultValue("https://api.pexels.com") String baseUrl,
            @DefaultValue("15") @Positive int perPage,
            @DefaultValue("10") @Positive int timeoutSeconds) {
    }

    public record Render(
            @DefaultValue("output") String outputDir,
            @DefaultValue("LANDSCAPE_16_9") OutputPreset defaultPreset) {
    }
}
