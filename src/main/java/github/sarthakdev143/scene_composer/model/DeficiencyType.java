package github.sarthakdev143.scene_composer.model;

public enum DeficiencyType {
    ASSET_MISSING,
    CANDIDATE_SEARCH_FAILED,
    OVERRIDE_NOT_FOUND
}
