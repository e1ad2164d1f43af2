package github.sarthakdev143.scene_composer.model;

public enum ResolutionStatus {
    RESOLVED,
    MANUAL_OVERRIDE,
    PLACEHOLDER,
    MISSING;

    public boolean isFallback() {
        return this == PLACEHOLDER || this == MISSING;
    }
}
