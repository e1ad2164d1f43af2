package github.sarthakdev143.scene_composer.model.rules;

import github.sarthakdev143.scene_composer.model.Emotion;
import github.sarthakdev143.scene_composer.model.Pace;
import github.sarthakdev143.scene_composer.model.SectionLabel;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Lookup tables driving rule-based section profiling: base profile per label and the two
 * lexicons that nudge energy up or down.
 */
public record ProfileRules(
        Map<SectionLabel, LabelProfile> labelProfiles,
        LabelProfile fallbackProfile,
        Set<String> highEnergyTerms,
        Set<String> calmingTerms,
        double hitIncrement,
        double maxAdjustment) {

    public static final LabelProfile NEUTRAL_PROFILE = new LabelProfile(5.0, Emotion.NEUTRAL, Pace.MEDIUM);

    public ProfileRules {
        EnumMap<SectionLabel, LabelProfile> profiles = new EnumMap<>(SectionLabel.class);
        if (labelProfiles != null) {
            profiles.putAll(labelProfiles);
        }
        labelProfiles = Map.copyOf(profiles);
        fallbackProfile = fallbackProfile == null ? NEUTRAL_PROFILE : fallbackProfile;
        highEnergyTerms = normalize(highEnergyTerms);
        calmingTerms = normalize(calmingTerms);
        if (hitIncrement < 0.0 || maxAdjustment < 0.0) {
            throw new IllegalArgumentException("hitIncrement and maxAdjustment must not be negative.");
        }
    }

    public LabelProfile profileFor(SectionLabel label) {
        return labelProfiles.getOrDefault(label, fallbackProfile);
    }

    public static ProfileRules defaults() {
        Map<SectionLabel, LabelProfile> profiles = new EnumMap<>(SectionLabel.class);
        profiles.put(SectionLabel.HOOK, new LabelProfile(9.0, Emotion.EXCITEMENT, Pace.FAST));
        profiles.put(SectionLabel.INTRODUCTION, new LabelProfile(6.0, Emotion.CURIOSITY, Pace.MEDIUM));
        profiles.put(SectionLabel.BACKGROUND, new LabelProfile(4.0, Emotion.CALM, Pace.SLOW));
        profiles.put(SectionLabel.MAIN_CONTENT, new LabelProfile(7.0, Emotion.FOCUS, Pace.MEDIUM));
        profiles.put(SectionLabel.APPLICATION, new LabelProfile(6.5, Emotion.INSPIRED, Pace.MEDIUM));
        profiles.put(SectionLabel.SUMMARY, new LabelProfile(5.0, Emotion.SATISFIED, Pace.SLOW));
        profiles.put(SectionLabel.CALL_TO_ACTION, new LabelProfile(8.5, Emotion.MOTIVATED, Pace.FAST));

        Set<String> highEnergy = Set.of(
                "amazing", "astonishing", "breakthrough", "discovery", "revolution", "revolutionary",
                "incredible", "unbelievable", "shocking", "stunning", "explosive", "secret",
                "revealed", "massive", "huge", "critical", "crucial", "essential",
                "changes everything", "mind-blowing");
        Set<String> calming = Set.of(
                "basic", "basics", "understand", "simple", "simply", "easy", "gentle", "steady",
                "gradually", "slowly", "stable", "calm", "relax", "familiar", "foundation",
                "step by step");

        return new ProfileRules(profiles, NEUTRAL_PROFILE, highEnergy, calming, 0.3, 2.0);
    }

    private static Set<String> normalize(Set<String> terms) {
        if (terms == null) {
            return Set.of();
        }
        return terms.stream()
                .filter(term -> term != null && !term.isBlank())
                .map(term -> term.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }
}
