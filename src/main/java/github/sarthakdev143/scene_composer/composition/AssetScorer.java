package github.sarthakdev143.scene_composer.composition;

import github.sarthakdev143.scene_composer.model.Asset;
import github.sarthakdev143.scene_composer.model.AssetKind;
import github.sarthakdev143.scene_composer.model.ScoreFactor;
import github.sarthakdev143.scene_composer.model.ScoredCandidate;
import github.sarthakdev143.scene_composer.model.ScriptSection;
import github.sarthakdev143.scene_composer.model.SemanticProfile;
import github.sarthakdev143.scene_composer.model.UsageContext;
import github.sarthakdev143.scene_composer.model.rules.ScoringWeights;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Weighted multi-factor match between a section and a candidate asset.
 *
 * <p>Factors are evaluated in declaration order of {@link ScoreFactor}. Each is capped on its own
 * and then by what is left of the total cap, so the total never exceeds the cap and always
 * equals the sum of the breakdown.
 */
@Component
public class AssetScorer {

    private static final int DERIVED_KEYWORD_LIMIT = 24;
    private static final int MIN_PARTIAL_MATCH_LENGTH = 4;
    private static final int MAX_RATING = 5;

    private final ScoringWeights weights;

    public AssetScorer(ScoringWeights weights) {
        this.weights = weights;
    }

    public ScoredCandidate score(
            SemanticProfile profile,
            ScriptSection section,
            Asset asset,
            UsageContext usageContext) {
        UsageContext usage = usageContext == null ? UsageContext.empty() : usageContext;
        List<String> derivedKeywords = derivedKeywords(section);

        Map<ScoreFactor, Double> breakdown = new EnumMap<>(ScoreFactor.class);
        double remaining = weights.totalCap();
        remaining = contribute(breakdown, ScoreFactor.TYPE_MATCH, typeMatch(profile, asset), remaining);
        remaining = contribute(breakdown, ScoreFactor.TAG_OVERLAP, tagOverlap(asset, derivedKeywords), remaining);
        remaining = contribute(breakdown, ScoreFactor.KEYWORD_MATCH, keywordMatch(asset, section.narration()), remaining);
        remaining = contribute(breakdown, ScoreFactor.RATING_BONUS, ratingBonus(asset), remaining);
        remaining = contribute(breakdown, ScoreFactor.USAGE_BONUS, usageBonus(asset, usage), remaining);

        return new ScoredCandidate(asset, weights.totalCap() - remaining, breakdown);
    }

    /**
     * Scores every distinct asset (first occurrence of an id wins) and ranks the results.
     */
    public List<ScoredCandidate> rank(
            SemanticProfile profile,
            ScriptSection section,
            Collection<Asset> assets,
            UsageContext usageContext) {
        if (assets == null || assets.isEmpty()) {
            return List.of();
        }

        Map<String, Asset> distinct = new LinkedHashMap<>();
        for (Asset asset : assets) {
            if (asset != null) {
                distinct.putIfAbsent(asset.id(), asset);
            }
        }

        List<ScoredCandidate> ranked = new ArrayList<>(distinct.size());
        for (Asset asset : distinct.values()) {
            ranked.add(score(profile, section, asset, usageContext));
        }
        ranked.sort(ScoredCandidate.RANKING);
        return List.copyOf(ranked);
    }

    // Hint and narration are capped separately so a long narration cannot crowd out the hint.
    private List<String> derivedKeywords(ScriptSection section) {
        Set<String> keywords = new LinkedHashSet<>(
                KeywordExtractor.keywords(DERIVED_KEYWORD_LIMIT, section.visualHint()));
        keywords.addAll(KeywordExtractor.keywords(DERIVED_KEYWORD_LIMIT, section.narration()));
        return List.copyOf(keywords);
    }

    private double typeMatch(SemanticProfile profile, Asset asset) {
        if (asset.kind() == null) {
            return 0.0;
        }
        AssetKind preferredKind = profile.pace().preferredKind();
        return preferredKind == null || preferredKind == asset.kind() ? weights.typeMatchWeight() : 0.0;
    }

    private double tagOverlap(Asset asset, List<String> derivedKeywords) {
        if (derivedKeywords.isEmpty()) {
            return 0.0;
        }
        String derivedText = " " + String.join(" ", derivedKeywords) + " ";
        int matches = 0;
        for (String tag : asset.tags()) {
            if (KeywordExtractor.containsTerm(derivedText, tag) || partiallyMatches(tag, derivedKeywords)) {
                matches++;
            }
        }
        return Math.min(matches * weights.tagOverlapPerHit(), weights.tagOverlapCap());
    }

    private boolean partiallyMatches(String tag, List<String> derivedKeywords) {
        if (tag.length() < MIN_PARTIAL_MATCH_LENGTH) {
            return false;
        }
        for (String keyword : derivedKeywords) {
            if (keyword.length() >= MIN_PARTIAL_MATCH_LENGTH && (keyword.contains(tag) || tag.contains(keyword))) {
                return true;
            }
        }
        return false;
    }

    private double keywordMatch(Asset asset, String narration) {
        if (narration == null || narration.isBlank()) {
            return 0.0;
        }
        String lowerNarration = narration.toLowerCase(Locale.ROOT);
        int matches = 0;
        for (String tag : asset.tags()) {
            if (lowerNarration.contains(tag)) {
                matches++;
            }
        }
        return Math.min(matches * weights.keywordMatchPerHit(), weights.keywordMatchCap());
    }

    private double ratingBonus(Asset asset) {
        Integer rating = asset.rating();
        if (rating == null || rating < 0 || rating > MAX_RATING) {
            return 0.0;
        }
        return Math.min(rating * weights.ratingMultiplier(), weights.ratingCap());
    }

    private double usageBonus(Asset asset, UsageContext usage) {
        int uses = Math.max(asset.usageCount(), 0) + usage.usesInRun(asset.id());
        return Math.min(uses * weights.usagePerUse(), weights.usageCap());
    }

    private double contribute(Map<ScoreFactor, Double> breakdown, ScoreFactor factor, double raw, double remaining) {
        double contribution = Math.max(0.0, Math.min(raw, remaining));
        breakdown.put(factor, contribution);
        return remaining - contribution;
    }
}
