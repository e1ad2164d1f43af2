package github.sarthakdev143.scene_composer.model.rules;

import github.sarthakdev143.scene_composer.model.Emotion;
import github.sarthakdev143.scene_composer.model.Pace;

public record LabelProfile(
        double baseEnergy,
        Emotion emotion,
        Pace pace) {
}
