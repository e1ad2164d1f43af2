package github.sarthakdev143.scene_composer.integration.pexels;

import com.fasterxml.jackson.databind.ObjectMapper;
import github.sarthakdev143.scene_composer.config.SceneComposerProperties;
import github.sarthakdev143.scene_composer.model.Asset;
import github.sarthakdev143.scene_composer.model.AssetKind;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PexelsAssetSourceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final PexelsAssetSource source = new PexelsAssetSource(
            new SceneComposerProperties.Pexels(true, "test-key", "https://api.pexels.com", 15, 10),
            objectMapper,
            HttpClient.newHttpClient());

    @Test
    void parsePhotosBuildsImageAssetsWithDerivedTags() throws Exception {
        String body = """
                {
                  "photos": [
                    {
                      "id": 12345,
                      "url": "https://www.pexels.com/photo/northern-lights-over-mountains-12345/",
                      "alt": "Aurora above snowy peaks",
                      "src": {"original": "https://images.pexels.com/12345/original.jpeg",
                              "large2x": "https://images.pexels.com/12345/large2x.jpeg"}
                    },
                    {
                      "id": 777,
                      "url": "https://www.pexels.com/photo/777/",
                      "src": {"original": "https://images.pexels.com/777/original.jpeg"}
                    },
                    {
                      "id": 888,
                      "url": "https://www.pexels.com/photo/888/"
                    }
                  ]
                }
                """;

        List<Asset> assets = source.parsePhotos(objectMapper.readTree(body));

        assertThat(assets).hasSize(2);
        Asset aurora = assets.get(0);
        assertThat(aurora.id()).isEqualTo("pexels-photo-12345");
        assertThat(aurora.kind()).isEqualTo(AssetKind.IMAGE);
        assertThat(aurora.location()).isEqualTo("https://images.pexels.com/12345/large2x.jpeg");
        assertThat(aurora.description()).isEqualTo("Aurora above snowy peaks");
        assertThat(aurora.tags()).containsExactly("aurora", "above", "snowy", "peaks", "northern", "lights", "mountains");
        assertThat(aurora.rating()).isNull();

        Asset fallback = assets.get(1);
        assertThat(fallback.location()).isEqualTo("https://images.pexels.com/777/original.jpeg");
        assertThat(fallback.description()).isNull();
        assertThat(fallback.tags()).isEmpty();
    }

    @Test
    void parseVideosPrefersFullHdFile() throws Exception {
        String body = """
                {
                  "videos": [
                    {
                      "id": 42,
                      "url": "https://www.pexels.com/video/waves-crashing-on-rocks-42/",
                      "video_files": [
                        {"quality": "sd", "width": 640, "link": "https://videos.pexels.com/42/sd.mp4"},
                        {"quality": "hd", "width": 1280, "link": "https://videos.pexels.com/42/hd-720.mp4"},
                        {"quality": "hd", "width": 1920, "link": "https://videos.pexels.com/42/hd-1080.mp4"}
                      ]
                    },
                    {
                      "id": 43,
                      "url": "https://www.pexels.com/video/43/",
                      "video_files": [
                        {"quality": "sd", "width": 640, "link": ""},
                        {"quality": "sd", "width": 960, "link": "https://videos.pexels.com/43/sd.mp4"}
                      ]
                    },
                    {
                      "id": 44,
                      "video_files": []
                    }
                  ]
                }
                """;

        List<Asset> assets = source.parseVideos(objectMapper.readTree(body));

        assertThat(assets).extracting(Asset::id).containsExactly("pexels-video-42", "pexels-video-43");
        assertThat(assets.get(0).kind()).isEqualTo(AssetKind.VIDEO);
        assertThat(assets.get(0).location()).isEqualTo("https://videos.pexels.com/42/hd-1080.mp4");
        assertThat(assets.get(0).tags()).contains("waves", "crashing", "rocks");
        assertThat(assets.get(1).location()).isEqualTo("https://videos.pexels.com/43/sd.mp4");
    }

    @Test
    void videoTagsDescribeTheFootageRatherThanTheSearch() throws Exception {
        String body = """
                {
                  "videos": [
                    {
                      "id": 51,
                      "url": "https://www.pexels.com/video/cat-sleeping-on-sofa-51/",
                      "video_files": [
                        {"quality": "hd", "width": 1920, "link": "https://videos.pexels.com/51/hd-1080.mp4"}
                      ]
                    }
                  ]
                }
                """;

        List<Asset> assets = source.parseVideos(objectMapper.readTree(body));

        assertThat(assets).hasSize(1);
        assertThat(assets.get(0).tags())
                .containsExactly("cat", "sleeping", "sofa")
                .doesNotContain("explore", "galaxy", "distant");
    }

    @Test
    void parseToleratesMissingArrays() throws Exception {
        assertThat(source.parsePhotos(objectMapper.readTree("{}"))).isEmpty();
        assertThat(source.parseVideos(objectMapper.readTree("{\"videos\": null}"))).isEmpty();
    }

    @Test
    void searchWithoutTermsDoesNotCallPexels() {
        assertThat(source.search(List.of(), AssetKind.VIDEO)).isEmpty();
    }

    @Test
    void findByIdIgnoresForeignIdsAndRejectsMalformedOnes() {
        assertThat(source.findById("catalog-asset")).isEmpty();
        assertThatThrownBy(() -> source.findById("pexels-photo-abc"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Malformed Pexels asset id");
    }

    @Test
    void requiresApiKey() {
        assertThatThrownBy(() -> new PexelsAssetSource(
                new SceneComposerProperties.Pexels(true, " ", "https://api.pexels.com", 15, 10),
                objectMapper,
                HttpClient.newHttpClient()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("api-key");
    }
}
