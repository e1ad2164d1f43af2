package github.sarthakdev143.scene_composer.composition;

import github.sarthakdev143.scene_composer.model.ProfileSource;
import github.sarthakdev143.scene_composer.model.ScriptSection;
import github.sarthakdev143.scene_composer.model.SemanticAnalysis;
import github.sarthakdev143.scene_composer.model.SemanticProfile;
import github.sarthakdev143.scene_composer.model.rules.LabelProfile;
import github.sarthakdev143.scene_composer.model.rules.ProfileRules;
import github.sarthakdev143.scene_composer.service.SemanticAnalysisService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Derives a {@link SemanticProfile} for a script section.
 *
 * <p>The rule path looks up the label's base profile and shifts energy by lexicon hits in the
 * narration. When a {@link SemanticAnalysisService} is configured its result replaces the rule
 * profile; any failure, timeout or unusable result silently keeps the rule profile.
 */
public class SectionProfiler {

    private static final Logger logger = LoggerFactory.getLogger(SectionProfiler.class);

    private final ProfileRules rules;
    private final SemanticAnalysisService analysisService;
    private final Executor analysisExecutor;
    private final Duration analysisTimeout;
    private final Counter analysisFallbackCounter;

    public SectionProfiler(ProfileRules rules) {
        this(rules, null, Runnable::run, Duration.ofSeconds(5), new SimpleMeterRegistry());
    }

    public SectionProfiler(
            ProfileRules rules,
            SemanticAnalysisService analysisService,
            Executor analysisExecutor,
            Duration analysisTimeout,
            MeterRegistry meterRegistry) {
        this.rules = rules;
        this.analysisService = analysisService;
        this.analysisExecutor = analysisExecutor;
        this.analysisTimeout = analysisTimeout;
        this.analysisFallbackCounter = meterRegistry.counter("scene_composer.analysis.fallbacks");
    }

    public SemanticProfile profile(ScriptSection section) {
        SemanticProfile ruleProfile = profileByRules(section);
        if (analysisService == null || section.narration().isBlank()) {
            return ruleProfile;
        }

        return analyze(section)
                .map(analysis -> new SemanticProfile(
                        analysis.energy(),
                        analysis.emotion() == null ? ruleProfile.emotion() : analysis.emotion(),
                        analysis.pace() == null ? ruleProfile.pace() : analysis.pace(),
                        new TreeSet<>(analysis.keywords()),
                        ProfileSource.ANALYSIS_SERVICE))
                .orElse(ruleProfile);
    }

    SemanticProfile profileByRules(ScriptSection section) {
        LabelProfile base = rules.profileFor(section.label());
        String normalizedNarration = KeywordExtractor.normalizedText(section.narration());

        SortedSet<String> hits = new TreeSet<>();
        int highEnergyHits = 0;
        int calmingHits = 0;
        for (String term : rules.highEnergyTerms()) {
            if (KeywordExtractor.containsTerm(normalizedNarration, term)) {
                hits.add(term);
                highEnergyHits++;
            }
        }
        for (String term : rules.calmingTerms()) {
            if (KeywordExtractor.containsTerm(normalizedNarration, term)) {
                hits.add(term);
                calmingHits++;
            }
        }

        double boost = Math.min(highEnergyHits * rules.hitIncrement(), rules.maxAdjustment());
        double damping = Math.min(calmingHits * rules.hitIncrement(), rules.maxAdjustment());
        double energy = base.baseEnergy() + boost - damping;

        return new SemanticProfile(energy, base.emotion(), base.pace(), hits, ProfileSource.RULES);
    }

    private Optional<SemanticAnalysis> analyze(ScriptSection section) {
        CompletableFuture<SemanticAnalysis> future = CompletableFuture.supplyAsync(
                () -> analysisService.analyze(section.narration()),
                analysisExecutor);
        try {
            SemanticAnalysis analysis = future.get(analysisTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (analysis != null && analysis.isUsable()) {
                return Optional.of(analysis);
            }
            logger.warn("Semantic analysis returned no usable energy for section {}; using rule profile",
                    section.index());
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.warn("Semantic analysis timed out after {} ms for section {}; using rule profile",
                    analysisTimeout.toMillis(),
                    section.index());
        } catch (ExecutionException e) {
            logger.warn("Semantic analysis failed for section {}; using rule profile",
                    section.index(),
                    e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Semantic analysis interrupted for section {}; using rule profile", section.index());
        }
        analysisFallbackCounter.increment();
        return Optional.empty();
    }
}
