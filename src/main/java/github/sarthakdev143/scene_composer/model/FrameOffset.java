package github.sarthakdev143.scene_composer.model;

/**
 * Pan offset expressed as a fraction of the frame width and height.
 */
public record FrameOffset(double x, double y) {

    public static final FrameOffset CENTER = new FrameOffset(0.0, 0.0);
}
