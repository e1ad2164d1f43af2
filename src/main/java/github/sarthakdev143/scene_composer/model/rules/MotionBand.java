package github.sarthakdev143.scene_composer.model.rules;

import github.sarthakdev143.scene_composer.model.FrameOffset;
import github.sarthakdev143.scene_composer.model.MotionPattern;

/**
 * Motion applied to sections whose energy is at least {@code minEnergy} and below the next
 * band's lower bound.
 */
public record MotionBand(
        double minEnergy,
        MotionPattern pattern,
        double startScale,
        double endScale,
        FrameOffset startOffset,
        FrameOffset endOffset) {

    public MotionBand {
        if (startScale <= 0.0 || endScale <= 0.0) {
            throw new IllegalArgumentException("motion scales must be greater than 0.");
        }
        startOffset = startOffset == null ? FrameOffset.CENTER : startOffset;
        endOffset = endOffset == null ? FrameOffset.CENTER : endOffset;
    }
}
