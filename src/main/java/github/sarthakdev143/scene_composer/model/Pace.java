package github.sarthakdev143.scene_composer.model;

import java.util.Locale;

public enum Pace {
    SLOW,
    MEDIUM,
    FAST;

    /**
     * Still-image sections are acceptable only where the pace is slow; faster sections prefer
     * footage.
     */
    public AssetKind preferredKind() {
        return this == SLOW ? null : AssetKind.VIDEO;
    }

    public static Pace fromInput(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String normalized = input.trim().toUpperCase(Locale.ROOT);
        if ("MODERATE".equals(normalized)) {
            return MEDIUM;
        }
        try {
            return Pace.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }
}
