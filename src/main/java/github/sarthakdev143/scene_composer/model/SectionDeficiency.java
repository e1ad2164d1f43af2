package github.sarthakdev143.scene_composer.model;

public record SectionDeficiency(
        int sectionIndex,
        DeficiencyType type,
        String message) {
}
