package github.sarthakdev143.scene_composer.model;

public enum AssetKind {
    IMAGE,
    VIDEO
}
