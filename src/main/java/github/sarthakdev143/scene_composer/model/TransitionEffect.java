package github.sarthakdev143.scene_composer.model;

public enum TransitionEffect {
    FADE("fadeblack"),
    CROSSFADE("fade"),
    ZOOM_IN("zoomin"),
    ZOOM_OUT("circleopen"),
    SLIDE_LEFT("slideleft"),
    SLIDE_RIGHT("slideright"),
    NONE("fade");

    private final String xfadeName;

    TransitionEffect(String xfadeName) {
        this.xfadeName = xfadeName;
    }

    public String xfadeName() {
        return xfadeName;
    }
}
