package github.sarthakdev143.scene_composer.model.rules;

public record ScoringWeights(
        double typeMatchWeight,
        double tagOverlapPerHit,
        double tagOverlapCap,
        double keywordMatchPerHit,
        double keywordMatchCap,
        double ratingMultiplier,
        double ratingCap,
        double usagePerUse,
        double usageCap,
        double totalCap) {

    public ScoringWeights {
        if (typeMatchWeight < 0 || tagOverlapPerHit < 0 || tagOverlapCap < 0
                || keywordMatchPerHit < 0 || keywordMatchCap < 0 || ratingMultiplier < 0
                || ratingCap < 0 || usagePerUse < 0 || usageCap < 0 || totalCap <= 0) {
            throw new IllegalArgumentException("scoring weights must not be negative.");
        }
    }

    public static ScoringWeights defaults() {
        return new ScoringWeights(30.0, 10.0, 30.0, 10.0, 30.0, 2.0, 10.0, 1.0, 10.0, 100.0);
    }
}
