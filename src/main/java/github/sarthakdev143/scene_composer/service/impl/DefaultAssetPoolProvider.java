package github.sarthakdev143.scene_composer.service.impl;

import github.sarthakdev143.scene_composer.model.Asset;
import github.sarthakdev143.scene_composer.model.AssetKind;
import github.sarthakdev143.scene_composer.service.AssetPoolProvider;
import github.sarthakdev143.scene_composer.service.AssetSearchException;
import github.sarthakdev143.scene_composer.service.AssetSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Merges every registered {@link AssetSource}. Sources are queried in order and the first
 * occurrence of an asset id wins. A failing source is skipped; only when every source fails is
 * the search reported as failed.
 */
@Service
public class DefaultAssetPoolProvider implements AssetPoolProvider {

    private static final Logger logger = LoggerFactory.getLogger(DefaultAssetPoolProvider.class);

    private final List<AssetSource> sources;

    public DefaultAssetPoolProvider(List<AssetSource> sources) {
        this.sources = sources == null ? List.of() : List.copyOf(sources);
    }

    @Override
    public List<Asset> search(List<String> queryTerms, AssetKind preferredKind) {
        Map<String, Asset> merged = new LinkedHashMap<>();
        List<String> failures = new ArrayList<>();

        for (AssetSource source : sources) {
            try {
                List<Asset> found = source.search(queryTerms, preferredKind);
                if (found == null) {
                    continue;
                }
                for (Asset asset : found) {
                    merged.putIfAbsent(asset.id(), asset);
                }
                logger.debug("Source {} returned {} assets for terms={}", source.name(), found.size(), queryTerms);
            } catch (RuntimeException e) {
                failures.add(source.name());
                logger.warn("Asset source {} failed for terms={}", source.name(), queryTerms, e);
            }
        }

        if (!sources.isEmpty() && failures.size() == sources.size()) {
            throw new AssetSearchException("All asset sources failed: " + String.join(", ", failures));
        }
        return List.copyOf(merged.values());
    }

    @Override
    public Optional<Asset> findById(String assetId) {
        if (assetId == null || assetId.isBlank()) {
            return Optional.empty();
        }
        for (AssetSource source : sources) {
            try {
                Optional<Asset> asset = source.findById(assetId);
                if (asset.isPresent()) {
                    return asset;
                }
            } catch (RuntimeException e) {
                logger.warn("Asset source {} failed looking up {}", source.name(), assetId, e);
            }
        }
        return Optional.empty();
    }
}
