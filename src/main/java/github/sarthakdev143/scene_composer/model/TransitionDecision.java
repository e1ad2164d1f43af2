package github.sarthakdev143.scene_composer.model;

public record TransitionDecision(
        int fromIndex,
        int toIndex,
        TransitionEffect effect,
        double durationSeconds,
        String reason,
        TransitionRule rule) {
}
