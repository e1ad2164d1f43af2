package github.sarthakdev143.scene_composer.model.rules;

import github.sarthakdev143.scene_composer.model.TransitionEffect;

/**
 * Fixed transition for a known narrative step. A null duration means the effect's standard
 * duration applies.
 */
public record PairRule(
        TransitionEffect effect,
        String reason,
        Double durationSeconds) {

    public PairRule(TransitionEffect effect, String reason) {
        this(effect, reason, null);
    }
}
