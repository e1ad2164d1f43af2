package github.sarthakdev143.scene_composer.model;

import java.util.Locale;

public enum Emotion {
    EXCITEMENT,
    CURIOSITY,
    CALM,
    FOCUS,
    INSPIRED,
    SATISFIED,
    MOTIVATED,
    NEUTRAL;

    public static Emotion fromInput(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        try {
            return Emotion.valueOf(input.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }
}
