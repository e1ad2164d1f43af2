package github.sarthakdev143.scene_composer.composition;

import github.sarthakdev143.scene_composer.model.Asset;
import github.sarthakdev143.scene_composer.model.MotionPlan;
import github.sarthakdev143.scene_composer.model.ScriptSection;
import github.sarthakdev143.scene_composer.model.SemanticProfile;
import github.sarthakdev143.scene_composer.model.rules.MotionBand;
import github.sarthakdev143.scene_composer.model.rules.MotionBands;
import org.springframework.stereotype.Component;

@Component
public class MotionGenerator {

    private final MotionBands bands;

    public MotionGenerator(MotionBands bands) {
        this.bands = bands;
    }

    /**
     * Pan/zoom curve for a still image, or {@code null} for footage and sections flagged static.
     */
    public MotionPlan generate(ScriptSection section, Asset asset, SemanticProfile profile) {
        if (asset == null || !asset.isStillImage() || section.staticVisual()) {
            return null;
        }

        MotionBand band = bands.bandFor(profile.energy());
        return new MotionPlan(
                asset.id(),
                band.pattern(),
                band.startScale(),
                band.endScale(),
                band.startOffset(),
                band.endOffset(),
                section.targetDuration());
    }
}
