package github.sarthakdev143.scene_composer.model;

import java.util.List;

public record TimelineEntry(
        ScriptSection section,
        SemanticProfile profile,
        Asset asset,
        ScoredCandidate selection,
        MotionPlan motionPlan,
        TransitionDecision inboundTransition,
        ResolutionStatus status,
        List<SectionDeficiency> deficiencies) {

    public TimelineEntry {
        deficiencies = deficiencies == null ? List.of() : List.copyOf(deficiencies);
    }

    public int index() {
        return section.index();
    }

    public boolean hasAsset() {
        return asset != null;
    }
}
