package github.sarthakdev143.scene_composer.model.rules;

import github.sarthakdev143.scene_composer.model.FrameOffset;
import github.sarthakdev143.scene_composer.model.MotionPattern;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ordered energy bands. Bands are sorted by descending lower bound and must start at 0 so that
 * every energy value in [0, 10] maps to exactly one band.
 */
public record MotionBands(List<MotionBand> bands) {

    public MotionBands {
        if (bands == null || bands.isEmpty()) {
            throw new IllegalArgumentException("at least one motion band is required.");
        }
        List<MotionBand> sorted = new ArrayList<>(bands);
        sorted.sort(Comparator.comparingDouble(MotionBand::minEnergy).reversed());
        for (int index = 1; index < sorted.size(); index++) {
            if (sorted.get(index).minEnergy() == sorted.get(index - 1).minEnergy()) {
                throw new IllegalArgumentException(
                        "motion bands overlap at energy " + sorted.get(index).minEnergy() + ".");
            }
        }
        if (sorted.get(sorted.size() - 1).minEnergy() != 0.0) {
            throw new IllegalArgumentException("the lowest motion band must start at energy 0.");
        }
        bands = List.copyOf(sorted);
    }

    public MotionBand bandFor(double energy) {
        for (MotionBand band : bands) {
            if (energy >= band.minEnergy()) {
                return band;
            }
        }
        return bands.get(bands.size() - 1);
    }

    public static MotionBands defaults() {
        return new MotionBands(List.of(
                new MotionBand(8.5, MotionPattern.FAST_ZOOM_IN, 1.0, 1.3, null, null),
                new MotionBand(7.5, MotionPattern.DIAGONAL_ZOOM, 1.0, 1.2,
                        FrameOffset.CENTER, new FrameOffset(-0.05, -0.05)),
                new MotionBand(6.0, MotionPattern.SLOW_ZOOM_IN, 1.0, 1.15, null, null),
                new MotionBand(4.5, MotionPattern.HORIZONTAL_PAN, 1.0, 1.0,
                        FrameOffset.CENTER, new FrameOffset(-0.08, 0.0)),
                new MotionBand(2.0, MotionPattern.GENTLE_ZOOM_OUT, 1.1, 1.0, null, null),
                new MotionBand(0.0, MotionPattern.STATIC_HOLD, 1.0, 1.0, null, null)));
    }
}
