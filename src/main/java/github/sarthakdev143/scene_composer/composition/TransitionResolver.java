package github.sarthakdev143.scene_composer.composition;

import github.sarthakdev143.scene_composer.model.ScriptSection;
import github.sarthakdev143.scene_composer.model.SectionLabel;
import github.sarthakdev143.scene_composer.model.SemanticProfile;
import github.sarthakdev143.scene_composer.model.TransitionDecision;
import github.sarthakdev143.scene_composer.model.TransitionEffect;
import github.sarthakdev143.scene_composer.model.TransitionRule;
import github.sarthakdev143.scene_composer.model.rules.PairRule;
import github.sarthakdev143.scene_composer.model.rules.TransitionRules;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Picks the transition between two adjacent sections. First match wins: explicit label pair,
 * then energy delta, then the default. Pure function of its inputs.
 */
@Component
public class TransitionResolver {

    private final TransitionRules rules;

    public TransitionResolver(TransitionRules rules) {
        this.rules = rules;
    }

    public TransitionDecision resolve(
            int fromIndex,
            SemanticProfile fromProfile,
            SectionLabel fromLabel,
            int toIndex,
            SemanticProfile toProfile,
            SectionLabel toLabel) {
        PairRule pairRule = rules.pairRule(fromLabel, toLabel);
        if (pairRule != null) {
            double duration = pairRule.durationSeconds() == null
                    ? rules.durationOf(pairRule.effect())
                    : pairRule.durationSeconds();
            return new TransitionDecision(
                    fromIndex,
                    toIndex,
                    pairRule.effect(),
                    duration,
                    pairRule.reason(),
                    TransitionRule.PAIR_RULE);
        }

        if (fromProfile == null || toProfile == null) {
            return new TransitionDecision(
                    fromIndex,
                    toIndex,
                    rules.defaultEffect(),
                    rules.defaultDurationSeconds(),
                    "no profile available; keep continuity",
                    TransitionRule.DEFAULT);
        }

        double delta = toProfile.energy() - fromProfile.energy();
        TransitionEffect effect;
        String reason;
        if (delta > rules.energyDeltaThreshold()) {
            effect = TransitionEffect.ZOOM_IN;
            reason = String.format(Locale.ROOT, "energy rises by %.1f; emphasize rising intensity", delta);
        } else if (delta < -rules.energyDeltaThreshold()) {
            effect = TransitionEffect.FADE;
            reason = String.format(Locale.ROOT, "energy drops by %.1f; settle down", -delta);
        } else {
            effect = TransitionEffect.CROSSFADE;
            reason = String.format(Locale.ROOT, "energy shifts by %.1f; keep continuity", delta);
        }
        return new TransitionDecision(
                fromIndex,
                toIndex,
                effect,
                rules.durationOf(effect),
                reason,
                TransitionRule.ENERGY_DELTA);
    }

    public TransitionDecision between(
            ScriptSection from,
            SemanticProfile fromProfile,
            ScriptSection to,
            SemanticProfile toProfile) {
        return resolve(from.index(), fromProfile, from.label(), to.index(), toProfile, to.label());
    }

    /**
     * One decision per adjacent pair of the ordered sections.
     */
    public List<TransitionDecision> resolveAll(List<ScriptSection> sections, List<SemanticProfile> profiles) {
        if (sections.size() != profiles.size()) {
            throw new IllegalArgumentException("sections and profiles must have the same size.");
        }
        List<TransitionDecision> decisions = new ArrayList<>();
        for (int position = 1; position < sections.size(); position++) {
            decisions.add(between(
                    sections.get(position - 1),
                    profiles.get(position - 1),
                    sections.get(position),
                    profiles.get(position)));
        }
        return List.copyOf(decisions);
    }
}
