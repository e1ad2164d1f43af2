package github.sarthakdev143.scene_composer.dto;

public record SectionRequest(
        Integer index,
        String label,
        String name,
        String narration,
        String visualHint,
        Double targetDuration,
        Boolean staticVisual) {
}
