package github.sarthakdev143.scene_composer.model;

import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.Map;

public record ScoredCandidate(
        Asset asset,
        double totalScore,
        Map<ScoreFactor, Double> breakdown) {

    /**
     * Highest score first; equal scores fall back to ascending asset id.
     */
    public static final Comparator<ScoredCandidate> RANKING = Comparator
            .comparingDouble(ScoredCandidate::totalScore)
            .reversed()
            .thenComparing(candidate -> candidate.asset().id());

    public ScoredCandidate {
        EnumMap<ScoreFactor, Double> copy = new EnumMap<>(ScoreFactor.class);
        if (breakdown != null) {
            copy.putAll(breakdown);
        }
        breakdown = Collections.unmodifiableMap(copy);
    }

    public double contribution(ScoreFactor factor) {
        return breakdown.getOrDefault(factor, 0.0);
    }
}
