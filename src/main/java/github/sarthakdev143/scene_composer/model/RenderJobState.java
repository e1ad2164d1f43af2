package github.sarthakdev143.scene_composer.model;

public enum RenderJobState {
    QUEUED,
    PROCESSING,
    COMPLETED,
    FAILED
}
