package github.sarthakdev143.scene_composer.model;

import java.util.List;

/**
 * Result returned by an external semantic-analysis service. Any field may be missing; the
 * profiler only accepts results carrying a finite energy value.
 */
public record SemanticAnalysis(
        Double energy,
        Emotion emotion,
        Pace pace,
        List<String> keywords) {

    public SemanticAnalysis {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }

    public boolean isUsable() {
        return energy != null && Double.isFinite(energy);
    }
}
