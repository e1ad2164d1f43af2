package github.sarthakdev143.scene_composer.integration.catalog;

import github.sarthakdev143.scene_composer.config.SceneComposerProperties;
import github.sarthakdev143.scene_composer.model.Asset;
import github.sarthakdev143.scene_composer.model.AssetKind;
import github.sarthakdev143.scene_composer.service.AssetSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Local material library declared under {@code scene-composer.catalog.assets}.
 *
 * <p>An asset matches a query when any term appears in one of its tags or in its description.
 * Assets of the preferred kind are listed first; nothing is filtered out by kind.
 */
@Component
public class CatalogAssetSource implements AssetSource {

    private static final Logger logger = LoggerFactory.getLogger(CatalogAssetSource.class);

    private final Map<String, Asset> assetsById;

    public CatalogAssetSource(SceneComposerProperties properties) {
        this(toAssets(properties.catalog().assets()));
    }

    CatalogAssetSource(List<Asset> assets) {
        Map<String, Asset> byId = new LinkedHashMap<>();
        for (Asset asset : assets) {
            if (byId.putIfAbsent(asset.id(), asset) != null) {
                logger.warn("Duplicate catalog asset id {} ignored", asset.id());
            }
        }
        this.assetsById = byId;
        logger.info("Loaded {} catalog assets", byId.size());
    }

    @Override
    public String name() {
        return "catalog";
    }

    @Override
    public List<Asset> search(List<String> queryTerms, AssetKind preferredKind) {
        List<Asset> matches = new ArrayList<>();
        for (Asset asset : assetsById.values()) {
            if (queryTerms == null || queryTerms.isEmpty() || matchesAny(asset, queryTerms)) {
                matches.add(asset);
            }
        }
        if (preferredKind != null) {
            matches.sort(Comparator.comparing(asset -> asset.kind() == preferredKind ? 0 : 1));
        }
        return List.copyOf(matches);
    }

    @Override
    public Optional<Asset> findById(String assetId) {
        if (assetId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(assetsById.get(assetId.trim()));
    }

    private boolean matchesAny(Asset asset, List<String> queryTerms) {
        String description = asset.description() == null ? "" : asset.description().toLowerCase(Locale.ROOT);
        for (String term : queryTerms) {
            String normalizedTerm = term.toLowerCase(Locale.ROOT);
            if (description.contains(normalizedTerm)) {
                return true;
            }
            for (String tag : asset.tags()) {
                if (tag.contains(normalizedTerm)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static List<Asset> toAssets(List<SceneComposerProperties.CatalogAsset> entries) {
        List<Asset> assets = new ArrayList<>(entries.size());
        for (SceneComposerProperties.CatalogAsset entry : entries) {
            assets.add(new Asset(
                    entry.id(),
                    entry.kind(),
                    entry.tags() == null ? null : new LinkedHashSet<>(entry.tags()),
                    entry.rating(),
                    entry.usageCount(),
                    entry.location(),
                    entry.description()));
        }
        return assets;
    }
}
