package github.sarthakdev143.scene_composer.service.impl;

import github.sarthakdev143.scene_composer.model.Asset;
import github.sarthakdev143.scene_composer.model.AssetKind;
import github.sarthakdev143.scene_composer.service.AssetSearchException;
import github.sarthakdev143.scene_composer.service.AssetSource;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultAssetPoolProviderTest {

    private static final Asset LOCAL_OCEAN = new Asset("ocean", AssetKind.VIDEO, Set.of("ocean"), 5, 0);
    private static final Asset REMOTE_OCEAN = new Asset("ocean", AssetKind.VIDEO, Set.of("sea"), 1, 0);
    private static final Asset REMOTE_WAVES = new Asset("waves", AssetKind.IMAGE, Set.of("waves"), null, 0);

    @Test
    void searchMergesSourcesAndFirstOccurrenceWins() {
        DefaultAssetPoolProvider provider = new DefaultAssetPoolProvider(List.of(
                new FakeSource("catalog", List.of(LOCAL_OCEAN)),
                new FakeSource("remote", List.of(REMOTE_OCEAN, REMOTE_WAVES))));

        List<Asset> assets = provider.search(List.of("ocean"), AssetKind.VIDEO);

        assertThat(assets).containsExactly(LOCAL_OCEAN, REMOTE_WAVES);
    }

    @Test
    void searchSkipsFailingSource() {
        DefaultAssetPoolProvider provider = new DefaultAssetPoolProvider(List.of(
                FakeSource.failing("remote"),
                new FakeSource("catalog", List.of(LOCAL_OCEAN))));

        assertThat(provider.search(List.of("ocean"), null)).containsExactly(LOCAL_OCEAN);
    }

    @Test
    void searchFailsWhenEverySourceFails() {
        DefaultAssetPoolProvider provider = new DefaultAssetPoolProvider(List.of(
                FakeSource.failing("catalog"),
                FakeSource.failing("remote")));

        assertThatThrownBy(() -> provider.search(List.of("ocean"), null))
                .isInstanceOf(AssetSearchException.class)
                .hasMessage("All asset sources failed: catalog, remote");
    }

    @Test
    void searchWithoutSourcesIsEmpty() {
        assertThat(new DefaultAssetPoolProvider(List.of()).search(List.of("ocean"), null)).isEmpty();
    }

    @Test
    void findByIdReturnsFirstSourceThatKnowsTheAsset() {
        DefaultAssetPoolProvider provider = new DefaultAssetPoolProvider(List.of(
                FakeSource.failing("broken"),
                new FakeSource("catalog", List.of(REMOTE_WAVES)),
                new FakeSource("remote", List.of(LOCAL_OCEAN))));

        assertThat(provider.findById("waves")).contains(REMOTE_WAVES);
        assertThat(provider.findById("ocean")).contains(LOCAL_OCEAN);
        assertThat(provider.findById("unknown")).isEmpty();
        assertThat(provider.findById(" ")).isEmpty();
    }

    private static final class FakeSource implements AssetSource {

        private final String name;
        private final List<Asset> assets;
        private final boolean failing;

        private FakeSource(String name, List<Asset> assets) {
            this(name, assets, false);
        }

        private FakeSource(String name, List<Asset> assets, boolean failing) {
            this.name = name;
            this.assets = assets;
            this.failing = failing;
        }

        static FakeSource failing(String name) {
            return new FakeSource(name, List.of(), true);
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public List<Asset> search(List<String> queryTerms, AssetKind preferredKind) {
            if (failing) {
                throw new AssetSearchException(name + " unavailable");
            }
            return assets;
        }

        @Override
        public Optional<Asset> findById(String assetId) {
            if (failing) {
                throw new AssetSearchException(name + " unavailable");
            }
            return assets.stream().filter(asset -> asset.id().equals(assetId)).findFirst();
        }
    }
}
