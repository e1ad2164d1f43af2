package github.sarthakdev143.scene_composer.model;

import java.util.List;

public record CompositionPreview(
        List<SectionCandidates> sections,
        CoverageReport coverage,
        double estimatedDurationSeconds) {

    public CompositionPreview {
        sections = sections == null ? List.of() : List.copyOf(sections);
    }
}
