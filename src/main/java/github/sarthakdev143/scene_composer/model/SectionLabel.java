package github.sarthakdev143.scene_composer.model;

import github.sarthakdev143.scene_composer.composition.KeywordExtractor;

import java.util.List;
import java.util.Locale;
import java.util.Map;

public enum SectionLabel {
    HOOK(List.of("hook", "opening", "teaser", "grabber")),
    INTRODUCTION(List.of("intro", "introduction", "preface", "overview")),
    BACKGROUND(List.of("background", "basics", "context", "prerequisite", "history")),
    MAIN_CONTENT(List.of("main", "core", "body", "explanation", "deep dive")),
    APPLICATION(List.of("application", "practice", "in action", "use case", "example")),
    SUMMARY(List.of("summary", "recap", "conclusion", "wrap up", "takeaway")),
    CALL_TO_ACTION(List.of("cta", "call to action", "subscribe", "follow", "action")),
    CUSTOM(List.of());

    private static final Map<String, SectionLabel> ALIASES = Map.of(
            "cta", CALL_TO_ACTION,
            "intro", INTRODUCTION,
            "main", MAIN_CONTENT,
            "outro", SUMMARY);

    private final List<String> nameKeywords;

    SectionLabel(List<String> nameKeywords) {
        this.nameKeywords = nameKeywords;
    }

    /**
     * Resolves a label from an explicit label string, falling back to whole-word keywords
     * found in the section name. Unknown input resolves to {@link #CUSTOM}.
     */
    public static SectionLabel resolve(String labelInput, String sectionName) {
        if (labelInput != null && !labelInput.isBlank()) {
            String normalized = labelInput.trim()
                    .toLowerCase(Locale.ROOT)
                    .replace('-', '_')
                    .replace(' ', '_');
            SectionLabel alias = ALIASES.get(normalized);
            if (alias != null) {
                return alias;
            }
            for (SectionLabel label : values()) {
                if (label.name().equalsIgnoreCase(normalized)) {
                    return label;
                }
            }
        }

        if (sectionName != null && !sectionName.isBlank()) {
            String name = KeywordExtractor.normalizedText(sectionName);
            for (SectionLabel label : values()) {
                for (String keyword : label.nameKeywords) {
                    if (KeywordExtractor.containsTerm(name, keyword)) {
                        return label;
                    }
                }
            }
        }

        return CUSTOM;
    }
}
