package github.sarthakdev143.scene_composer.model;

public enum TransitionRule {
    PAIR_RULE,
    ENERGY_DELTA,
    DEFAULT
}
