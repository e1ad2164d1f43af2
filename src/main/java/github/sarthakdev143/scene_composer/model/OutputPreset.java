package github.sarthakdev143.scene_composer.model;

import java.util.Locale;

public enum OutputPreset {
    LANDSCAPE_16_9(1920, 1080),
    PORTRAIT_9_16(1080, 1920),
    SQUARE_1_1(1080, 1080);

    private final int width;
    private final int height;

    OutputPreset(int width, int height) {
        this.width = width;
        this.height = height;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public static OutputPreset fromInput(String input, OutputPreset defaultPreset) {
        if (input == null || input.isBlank()) {
            return defaultPreset;
        }

        try {
            return OutputPreset.valueOf(input.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(
                    "outputPreset must be one of LANDSCAPE_16_9, PORTRAIT_9_16, SQUARE_1_1.");
        }
    }
}
