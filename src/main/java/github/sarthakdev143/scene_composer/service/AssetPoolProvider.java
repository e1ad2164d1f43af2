package github.sarthakdev143.scene_composer.service;

import github.sarthakdev143.scene_composer.model.Asset;
import github.sarthakdev143.scene_composer.model.AssetKind;

import java.util.List;
import java.util.Optional;

public interface AssetPoolProvider {

    /**
     * Candidate assets for the given query terms. {@code preferredKind} is a hint and may be null.
     *
     * @throws AssetSearchException when no backing store could be queried
     */
    List<Asset> search(List<String> queryTerms, AssetKind preferredKind);

    Optional<Asset> findById(String assetId);
}
