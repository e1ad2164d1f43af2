package github.sarthakdev143.scene_composer.model;

public enum ScoreFactor {
    TYPE_MATCH,
    TAG_OVERLAP,
    KEYWORD_MATCH,
    RATING_BONUS,
    USAGE_BONUS
}
