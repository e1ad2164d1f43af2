package github.sarthakdev143.scene_composer.model;

public enum ProfileSource {
    RULES,
    ANALYSIS_SERVICE
}
