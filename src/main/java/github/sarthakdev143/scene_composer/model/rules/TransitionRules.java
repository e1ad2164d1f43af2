package github.sarthakdev143.scene_composer.model.rules;

import github.sarthakdev143.scene_composer.model.SectionLabel;
import github.sarthakdev143.scene_composer.model.TransitionEffect;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

public record TransitionRules(
        Map<LabelPair, PairRule> pairRules,
        Map<TransitionEffect, Double> effectDurations,
        double energyDeltaThreshold,
        TransitionEffect defaultEffect,
        double defaultDurationSeconds) {

    public TransitionRules {
        pairRules = pairRules == null ? Map.of() : Map.copyOf(pairRules);
        EnumMap<TransitionEffect, Double> durations = new EnumMap<>(TransitionEffect.class);
        if (effectDurations != null) {
            durations.putAll(effectDurations);
        }
        for (TransitionEffect effect : TransitionEffect.values()) {
            if (!durations.containsKey(effect)) {
                throw new IllegalArgumentException("No duration configured for transition effect " + effect + ".");
            }
        }
        effectDurations = Map.copyOf(durations);
        if (energyDeltaThreshold <= 0.0) {
            throw new IllegalArgumentException("energyDeltaThreshold must be greater than 0.");
        }
        defaultEffect = defaultEffect == null ? TransitionEffect.CROSSFADE : defaultEffect;
    }

    public PairRule pairRule(SectionLabel from, SectionLabel to) {
        if (from == null || to == null) {
            return null;
        }
        return pairRules.get(new LabelPair(from, to));
    }

    public double durationOf(TransitionEffect effect) {
        return effectDurations.get(effect);
    }

    public static TransitionRules defaults() {
        Map<LabelPair, PairRule> pairs = new HashMap<>();
        pairs.put(new LabelPair(SectionLabel.HOOK, SectionLabel.INTRODUCTION),
                new PairRule(TransitionEffect.ZOOM_OUT, "hook settles into the introduction"));
        pairs.put(new LabelPair(SectionLabel.HOOK, SectionLabel.BACKGROUND),
                new PairRule(TransitionEffect.FADE, "high-energy opening eases into background"));
        pairs.put(new LabelPair(SectionLabel.INTRODUCTION, SectionLabel.BACKGROUND),
                new PairRule(TransitionEffect.FADE, "introduction flows into background"));
        pairs.put(new LabelPair(SectionLabel.INTRODUCTION, SectionLabel.MAIN_CONTENT),
                new PairRule(TransitionEffect.SLIDE_LEFT, "introduction advances to the main content"));
        pairs.put(new LabelPair(SectionLabel.BACKGROUND, SectionLabel.MAIN_CONTENT),
                new PairRule(TransitionEffect.ZOOM_IN, "background narrows onto the core point"));
        pairs.put(new LabelPair(SectionLabel.BACKGROUND, SectionLabel.APPLICATION),
                new PairRule(TransitionEffect.SLIDE_LEFT, "background advances to application"));
        pairs.put(new LabelPair(SectionLabel.MAIN_CONTENT, SectionLabel.APPLICATION),
                new PairRule(TransitionEffect.SLIDE_LEFT, "theory advances to practice"));
        pairs.put(new LabelPair(SectionLabel.MAIN_CONTENT, SectionLabel.SUMMARY),
                new PairRule(TransitionEffect.ZOOM_OUT, "main content pulls back for the summary"));
        pairs.put(new LabelPair(SectionLabel.MAIN_CONTENT, SectionLabel.MAIN_CONTENT),
                new PairRule(TransitionEffect.CROSSFADE, "main content continues"));
        pairs.put(new LabelPair(SectionLabel.APPLICATION, SectionLabel.SUMMARY),
                new PairRule(TransitionEffect.FADE, "application winds down into the summary"));
        pairs.put(new LabelPair(SectionLabel.APPLICATION, SectionLabel.CALL_TO_ACTION),
                new PairRule(TransitionEffect.ZOOM_IN, "application re-energises for the call to action"));
        pairs.put(new LabelPair(SectionLabel.SUMMARY, SectionLabel.CALL_TO_ACTION),
                new PairRule(TransitionEffect.ZOOM_IN, "summary re-energises for the call to action"));

        Map<TransitionEffect, Double> durations = new EnumMap<>(TransitionEffect.class);
        durations.put(TransitionEffect.FADE, 1.0);
        durations.put(TransitionEffect.CROSSFADE, 1.0);
        durations.put(TransitionEffect.ZOOM_IN, 0.8);
        durations.put(TransitionEffect.ZOOM_OUT, 1.2);
        durations.put(TransitionEffect.SLIDE_LEFT, 0.6);
        durations.put(TransitionEffect.SLIDE_RIGHT, 0.6);
        durations.put(TransitionEffect.NONE, 0.0);

        return new TransitionRules(pairs, durations, 3.0, TransitionEffect.CROSSFADE, 1.0);
    }
}
