package github.sarthakdev143.scene_composer.dto;

import java.util.List;
import java.util.Map;

/**
 * Script plus optional per-run overrides of the configured composition defaults.
 */
public record CompositionRequest(
        List<SectionRequest> sections,
        Double minimumScore,
        Map<Integer, String> manualOverrides,
        String placeholderAssetId,
        Integer candidateLimit,
        Boolean strictKindMatching) {
}
