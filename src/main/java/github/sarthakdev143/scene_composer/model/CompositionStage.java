package github.sarthakdev143.scene_composer.model;

public enum CompositionStage {
    IDLE,
    PROFILING,
    SCORING,
    ASSET_FOUND,
    ASSET_MISSING,
    MOTION_PLANNING,
    TRANSITION_RESOLVING,
    APPENDED
}
