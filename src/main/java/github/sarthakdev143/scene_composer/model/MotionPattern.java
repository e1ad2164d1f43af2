package github.sarthakdev143.scene_composer.model;

public enum MotionPattern {
    FAST_ZOOM_IN,
    DIAGONAL_ZOOM,
    SLOW_ZOOM_IN,
    HORIZONTAL_PAN,
    GENTLE_ZOOM_OUT,
    STATIC_HOLD
}
