package github.sarthakdev143.scene_composer.model;

import java.util.List;

public record SectionCandidates(
        ScriptSection section,
        SemanticProfile profile,
        List<ScoredCandidate> rankedCandidates,
        int acceptableCount) {

    public SectionCandidates {
        rankedCandidates = rankedCandidates == null ? List.of() : List.copyOf(rankedCandidates);
    }

    public boolean hasAcceptableCandidate() {
        return acceptableCount > 0;
    }
}
