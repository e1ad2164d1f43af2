package github.sarthakdev143.scene_composer.model;

import java.util.List;

public record TimelinePlan(
        List<TimelineEntry> entries,
        List<SectionDeficiency> deficiencies,
        double totalDurationSeconds) {

    public TimelinePlan {
        entries = entries == null ? List.of() : List.copyOf(entries);
        deficiencies = deficiencies == null ? List.of() : List.copyOf(deficiencies);
    }

    public boolean isFullyResolved() {
        return entries.stream().noneMatch(entry -> entry.status().isFallback());
    }

    public long countByStatus(ResolutionStatus status) {
        return entries.stream().filter(entry -> entry.status() == status).count();
    }
}
