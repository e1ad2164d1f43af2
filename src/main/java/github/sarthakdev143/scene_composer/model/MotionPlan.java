package github.sarthakdev143.scene_composer.model;

public record MotionPlan(
        String assetId,
        MotionPattern pattern,
        double startScale,
        double endScale,
        FrameOffset startOffset,
        FrameOffset endOffset,
        double durationSeconds) {

    public MotionPlan {
        startOffset = startOffset == null ? FrameOffset.CENTER : startOffset;
        endOffset = endOffset == null ? FrameOffset.CENTER : endOffset;
    }
}
