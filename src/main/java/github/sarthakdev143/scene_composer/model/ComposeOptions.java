package github.sarthakdev143.scene_composer.model;

import java.util.HashMap;
import java.util.Map;

/**
 * Per-run composition options.
 *
 * @param minimumScore       lowest acceptable total score for an automatically chosen asset
 * @param manualOverrides    section index to asset id; listed sections skip scoring
 * @param placeholder        asset substituted when nothing clears the threshold, may be null
 * @param candidateLimit     number of ranked candidates kept per section in previews
 * @param strictKindMatching drop candidates whose kind differs from the section's preferred kind; on by default
 */
public record ComposeOptions(
        double minimumScore,
        Map<Integer, String> manualOverrides,
        Asset placeholder,
        int candidateLimit,
        boolean strictKindMatching) {

    public static final double DEFAULT_MINIMUM_SCORE = 30.0;
    public static final int DEFAULT_CANDIDATE_LIMIT = 5;

    public ComposeOptions {
        if (!Double.isFinite(minimumScore) || minimumScore < 0.0 || minimumScore > 100.0) {
            throw new IllegalArgumentException("minimumScore must be between 0 and 100.");
        }
        manualOverrides = copyOverrides(manualOverrides);
        candidateLimit = candidateLimit <= 0 ? DEFAULT_CANDIDATE_LIMIT : candidateLimit;
    }

    public static ComposeOptions defaults() {
        return new ComposeOptions(DEFAULT_MINIMUM_SCORE, Map.of(), null, DEFAULT_CANDIDATE_LIMIT, true);
    }

    public ComposeOptions withPlaceholder(Asset placeholderAsset) {
        return new ComposeOptions(minimumScore, manualOverrides, placeholderAsset, candidateLimit, strictKindMatching);
    }

    private static Map<Integer, String> copyOverrides(Map<Integer, String> overrides) {
        if (overrides == null) {
            return Map.of();
        }
        Map<Integer, String> copy = new HashMap<>();
        for (Map.Entry<Integer, String> entry : overrides.entrySet()) {
            if (entry.getKey() == null) {
                throw new IllegalArgumentException("manualOverrides contains a null section index.");
            }
            if (entry.getValue() == null || entry.getValue().isBlank()) {
                throw new IllegalArgumentException("manualOverrides[" + entry.getKey() + "] must name an asset id.");
            }
            copy.put(entry.getKey(), entry.getValue());
        }
        return Map.copyOf(copy);
    }
}
