package github.sarthakdev143.scene_composer.service;

import github.sarthakdev143.scene_composer.model.Asset;
import github.sarthakdev143.scene_composer.model.AssetKind;

import java.util.List;
import java.util.Optional;

/**
 * One backing store of candidate visuals (local catalog, stock media API, ...).
 */
public interface AssetSource {

    String name();

    List<Asset> search(List<String> queryTerms, AssetKind preferredKind);

    Optional<Asset> findById(String assetId);
}
