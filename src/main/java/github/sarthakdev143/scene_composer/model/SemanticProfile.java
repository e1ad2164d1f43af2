package github.sarthakdev143.scene_composer.model;

import java.util.Collection;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

public record SemanticProfile(
        double energy,
        Emotion emotion,
        Pace pace,
        SortedSet<String> keywordHits,
        ProfileSource source) {

    public static final double MIN_ENERGY = 0.0;
    public static final double MAX_ENERGY = 10.0;

    public SemanticProfile {
        energy = clampEnergy(energy);
        emotion = emotion == null ? Emotion.NEUTRAL : emotion;
        pace = pace == null ? Pace.MEDIUM : pace;
        keywordHits = keywordHits == null
                ? Collections.emptySortedSet()
                : Collections.unmodifiableSortedSet(new TreeSet<>(keywordHits));
        source = source == null ? ProfileSource.RULES : source;
    }

    public static SemanticProfile of(double energy, Emotion emotion, Pace pace, Collection<String> keywordHits) {
        return new SemanticProfile(
                energy,
                emotion,
                pace,
                keywordHits == null ? null : new TreeSet<>(keywordHits),
                ProfileSource.RULES);
    }

    /**
     * Clamps to [0, 10] and rounds to one decimal so repeated increments do not drift.
     */
    public static double clampEnergy(double energy) {
        if (!Double.isFinite(energy)) {
            return 5.0;
        }
        double clamped = Math.max(MIN_ENERGY, Math.min(MAX_ENERGY, energy));
        return Math.round(clamped * 10.0) / 10.0;
    }
}
