package github.sarthakdev143.scene_composer.composition;

import github.sarthakdev143.scene_composer.model.Asset;
import github.sarthakdev143.scene_composer.model.AssetKind;
import github.sarthakdev143.scene_composer.model.ComposeOptions;
import github.sarthakdev143.scene_composer.model.CompositionPreview;
import github.sarthakdev143.scene_composer.model.CompositionStage;
import github.sarthakdev143.scene_composer.model.CoverageReport;
import github.sarthakdev143.scene_composer.model.DeficiencyType;
import github.sarthakdev143.scene_composer.model.MotionPlan;
import github.sarthakdev143.scene_composer.model.ResolutionStatus;
import github.sarthakdev143.scene_composer.model.ScoredCandidate;
import github.sarthakdev143.scene_composer.model.ScriptSection;
import github.sarthakdev143.scene_composer.model.SectionCandidates;
import github.sarthakdev143.scene_composer.model.SectionDeficiency;
import github.sarthakdev143.scene_composer.model.SemanticProfile;
import github.sarthakdev143.scene_composer.model.TimelineEntry;
import github.sarthakdev143.scene_composer.model.TimelinePlan;
import github.sarthakdev143.scene_composer.model.TransitionDecision;
import github.sarthakdev143.scene_composer.model.UsageContext;
import github.sarthakdev143.scene_composer.service.AssetPoolProvider;
import github.sarthakdev143.scene_composer.service.impl.ScriptValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Walks the ordered sections of a script and assembles a {@link TimelinePlan}.
 *
 * <p>Candidate pools may be fetched ahead of time on the injected executor, but every decision
 * that depends on earlier sections (usage counts, inbound transitions) is taken strictly in index
 * order, so the plan is the same whichever executor is used.
 */
@Component
public class CompositionOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(CompositionOrchestrator.class);
    private static final int MAX_QUERY_TERMS = 6;
    private static final int FULL_COVERAGE_CANDIDATES = 3;

    private final ScriptValidator scriptValidator;
    private final SectionProfiler sectionProfiler;
    private final AssetScorer assetScorer;
    private final MotionGenerator motionGenerator;
    private final TransitionResolver transitionResolver;
    private final AssetPoolProvider assetPoolProvider;
    private final Executor prefetchExecutor;

    public CompositionOrchestrator(
            ScriptValidator scriptValidator,
            SectionProfiler sectionProfiler,
            AssetScorer assetScorer,
            MotionGenerator motionGenerator,
            TransitionResolver transitionResolver,
            AssetPoolProvider assetPoolProvider,
            TaskExecutor prefetchExecutor) {
        this.scriptValidator = scriptValidator;
        this.sectionProfiler = sectionProfiler;
        this.assetScorer = assetScorer;
        this.motionGenerator = motionGenerator;
        this.transitionResolver = transitionResolver;
        this.assetPoolProvider = assetPoolProvider;
        this.prefetchExecutor = prefetchExecutor == null ? Runnable::run : prefetchExecutor;
    }

    public TimelinePlan compose(List<ScriptSection> sections, ComposeOptions options) {
        ComposeOptions effectiveOptions = options == null ? ComposeOptions.defaults() : options;
        List<ScriptSection> ordered = scriptValidator.validateAndOrder(sections);
        logger.info("Composing timeline for {} sections minimumScore={} overrides={} placeholder={}",
                ordered.size(),
                effectiveOptions.minimumScore(),
                effectiveOptions.manualOverrides().size(),
                effectiveOptions.placeholder() != null);

        List<SemanticProfile> profiles = profileAll(ordered);
        List<CompletableFuture<CandidatePool>> pools = startFetches(ordered, profiles, effectiveOptions);

        List<TimelineEntry> entries = new ArrayList<>();
        List<SectionDeficiency> deficiencies = new ArrayList<>();
        UsageContext usage = UsageContext.empty();
        try {
            for (int position = 0; position < ordered.size(); position++) {
                checkNotCancelled(position, ordered.size());
                ScriptSection section = ordered.get(position);
                SemanticProfile profile = profiles.get(position);

                SlotResolution slot = resolveSlot(section, profile, pools.get(position), effectiveOptions, usage);

                MotionPlan motionPlan = null;
                TransitionDecision inbound = null;
                if (slot.status() != ResolutionStatus.MISSING) {
                    enterStage(section, CompositionStage.MOTION_PLANNING);
                    motionPlan = motionGenerator.generate(section, slot.asset(), profile);

                    enterStage(section, CompositionStage.TRANSITION_RESOLVING);
                    if (position > 0) {
                        inbound = transitionResolver.between(
                                ordered.get(position - 1),
                                profiles.get(position - 1),
                                section,
                                profile);
                    }
                    if (slot.status() != ResolutionStatus.PLACEHOLDER) {
                        usage = usage.withUse(slot.asset().id());
                    }
                }

                entries.add(new TimelineEntry(
                        section,
                        profile,
                        slot.asset(),
                        slot.selection(),
                        motionPlan,
                        inbound,
                        slot.status(),
                        slot.deficiencies()));
                deficiencies.addAll(slot.deficiencies());
                enterStage(section, CompositionStage.APPENDED);
            }
        } finally {
            cancelOutstanding(pools);
        }

        TimelinePlan plan = new TimelinePlan(entries, deficiencies, totalDuration(ordered));
        logger.info("Composed timeline with {} entries resolved={} placeholders={} missing={} overrides={}",
                entries.size(),
                plan.countByStatus(ResolutionStatus.RESOLVED),
                plan.countByStatus(ResolutionStatus.PLACEHOLDER),
                plan.countByStatus(ResolutionStatus.MISSING),
                plan.countByStatus(ResolutionStatus.MANUAL_OVERRIDE));
        return plan;
    }

    /**
     * Dry run: profiles and scores every section without selecting assets, motion or transitions.
     */
    public CompositionPreview preview(List<ScriptSection> sections, ComposeOptions options) {
        ComposeOptions effectiveOptions = options == null ? ComposeOptions.defaults() : options;
        List<ScriptSection> ordered = scriptValidator.validateAndOrder(sections);
        List<SemanticProfile> profiles = profileAll(ordered);
        List<CompletableFuture<CandidatePool>> pools = startFetches(ordered, profiles, null);

        List<SectionCandidates> sectionCandidates = new ArrayList<>();
        int fullyCovered = 0;
        int partiallyCovered = 0;
        int notCovered = 0;
        try {
            for (int position = 0; position < ordered.size(); position++) {
                checkNotCancelled(position, ordered.size());
                ScriptSection section = ordered.get(position);
                SemanticProfile profile = profiles.get(position);

                CandidatePool pool = awaitPool(section, pools.get(position));
                List<ScoredCandidate> ranked = rankCandidates(section, profile, pool, effectiveOptions, UsageContext.empty());
                int acceptable = (int) ranked.stream()
                        .filter(candidate -> candidate.totalScore() >= effectiveOptions.minimumScore())
                        .count();

                if (acceptable >= FULL_COVERAGE_CANDIDATES) {
                    fullyCovered++;
                } else if (acceptable > 0) {
                    partiallyCovered++;
                } else {
                    notCovered++;
                }

                List<ScoredCandidate> top = ranked.subList(0, Math.min(ranked.size(), effectiveOptions.candidateLimit()));
                sectionCandidates.add(new SectionCandidates(section, profile, top, acceptable));
            }
        } finally {
            cancelOutstanding(pools);
        }

        double coverageRate = Math.round(fullyCovered * 10000.0 / ordered.size()) / 100.0;
        CoverageReport coverage = new CoverageReport(
                ordered.size(),
                fullyCovered,
                partiallyCovered,
                notCovered,
                coverageRate);
        logger.info("Previewed {} sections full={} partial={} none={}",
                ordered.size(),
                fullyCovered,
                partiallyCovered,
                notCovered);
        return new CompositionPreview(sectionCandidates, coverage, totalDuration(ordered));
    }

    public List<TransitionDecision> previewTransitions(List<ScriptSection> sections) {
        List<ScriptSection> ordered = scriptValidator.validateAndOrder(sections);
        return transitionResolver.resolveAll(ordered, profileAll(ordered));
    }

    private List<SemanticProfile> profileAll(List<ScriptSection> ordered) {
        List<SemanticProfile> profiles = new ArrayList<>(ordered.size());
        for (ScriptSection section : ordered) {
            enterStage(section, CompositionStage.PROFILING);
            profiles.add(sectionProfiler.profile(section));
        }
        return profiles;
    }

    /**
     * Starts candidate retrieval for every section. Sections with a manual override get no
     * prefetch and are fetched lazily only if the override cannot be resolved.
     */
    private List<CompletableFuture<CandidatePool>> startFetches(
            List<ScriptSection> ordered,
            List<SemanticProfile> profiles,
            ComposeOptions options) {
        List<CompletableFuture<CandidatePool>> pools = new ArrayList<>(ordered.size());
        for (int position = 0; position < ordered.size(); position++) {
            ScriptSection section = ordered.get(position);
            SemanticProfile profile = profiles.get(position);
            if (options != null && options.manualOverrides().containsKey(section.index())) {
                pools.add(null);
                continue;
            }
            try {
                pools.add(CompletableFuture.supplyAsync(() -> fetchCandidates(section, profile), prefetchExecutor));
            } catch (RejectedExecutionException e) {
                logger.debug("Prefetch rejected for section {}; fetching inline", section.index());
                pools.add(CompletableFuture.completedFuture(fetchCandidates(section, profile)));
            }
        }
        return pools;
    }

    private SlotResolution resolveSlot(
            ScriptSection section,
            SemanticProfile profile,
            CompletableFuture<CandidatePool> prefetched,
            ComposeOptions options,
            UsageContext usage) {
        List<SectionDeficiency> deficiencies = new ArrayList<>();

        String overrideId = options.manualOverrides().get(section.index());
        if (overrideId != null) {
            Optional<Asset> override = findOverride(overrideId);
            if (override.isPresent()) {
                enterStage(section, CompositionStage.ASSET_FOUND);
                return new SlotResolution(override.get(), null, ResolutionStatus.MANUAL_OVERRIDE, deficiencies);
            }
            deficiencies.add(new SectionDeficiency(
                    section.index(),
                    DeficiencyType.OVERRIDE_NOT_FOUND,
                    "Override asset " + overrideId + " was not found; falling back to scoring."));
            logger.warn("Override asset {} for section {} not found", overrideId, section.index());
        }

        enterStage(section, CompositionStage.SCORING);
        CandidatePool pool = prefetched == null
                ? fetchCandidates(section, profile)
                : awaitPool(section, prefetched);
        if (pool.failureMessage() != null) {
            deficiencies.add(new SectionDeficiency(
                    section.index(),
                    DeficiencyType.CANDIDATE_SEARCH_FAILED,
                    "Candidate search failed: " + pool.failureMessage()));
        }

        List<ScoredCandidate> ranked = rankCandidates(section, profile, pool, options, usage);
        if (!ranked.isEmpty() && ranked.get(0).totalScore() >= options.minimumScore()) {
            ScoredCandidate best = ranked.get(0);
            enterStage(section, CompositionStage.ASSET_FOUND);
            return new SlotResolution(best.asset(), best, ResolutionStatus.RESOLVED, deficiencies);
        }

        enterStage(section, CompositionStage.ASSET_MISSING);
        String message = ranked.isEmpty()
                ? "No candidate assets found."
                : String.format(Locale.ROOT,
                        "Best candidate %s scored %.1f, below minimum %.1f.",
                        ranked.get(0).asset().id(),
                        ranked.get(0).totalScore(),
                        options.minimumScore());
        deficiencies.add(new SectionDeficiency(section.index(), DeficiencyType.ASSET_MISSING, message));

        if (options.placeholder() != null) {
            return new SlotResolution(options.placeholder(), null, ResolutionStatus.PLACEHOLDER, deficiencies);
        }
        return new SlotResolution(null, null, ResolutionStatus.MISSING, deficiencies);
    }

    private Optional<Asset> findOverride(String overrideId) {
        try {
            Optional<Asset> asset = assetPoolProvider.findById(overrideId);
            return asset == null ? Optional.empty() : asset;
        } catch (RuntimeException e) {
            logger.warn("Override lookup failed for asset {}", overrideId, e);
            return Optional.empty();
        }
    }

    private List<ScoredCandidate> rankCandidates(
            ScriptSection section,
            SemanticProfile profile,
            CandidatePool pool,
            ComposeOptions options,
            UsageContext usage) {
        List<Asset> candidates = pool.assets();
        AssetKind preferredKind = profile.pace().preferredKind();
        if (options.strictKindMatching() && preferredKind != null) {
            candidates = candidates.stream()
                    .filter(asset -> asset.kind() == preferredKind)
                    .toList();
        }
        return assetScorer.rank(profile, section, candidates, usage);
    }

    private CandidatePool fetchCandidates(ScriptSection section, SemanticProfile profile) {
        List<String> queryTerms = KeywordExtractor.keywords(
                MAX_QUERY_TERMS,
                section.visualHint(),
                section.narration());
        try {
            List<Asset> assets = assetPoolProvider.search(queryTerms, profile.pace().preferredKind());
            return new CandidatePool(assets == null ? List.of() : List.copyOf(assets), null);
        } catch (RuntimeException e) {
            logger.warn("Candidate search failed for section {} terms={}", section.index(), queryTerms, e);
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            return new CandidatePool(List.of(), message);
        }
    }

    private CandidatePool awaitPool(ScriptSection section, CompletableFuture<CandidatePool> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompositionCancelledException(
                    "Composition cancelled while waiting for candidates of section " + section.index() + ".");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            logger.warn("Candidate prefetch failed for section {}", section.index(), cause);
            return new CandidatePool(List.of(), String.valueOf(cause.getMessage()));
        }
    }

    private void checkNotCancelled(int completed, int total) {
        if (Thread.currentThread().isInterrupted()) {
            throw new CompositionCancelledException(
                    "Composition cancelled after " + completed + " of " + total + " sections.");
        }
    }

    private void cancelOutstanding(List<CompletableFuture<CandidatePool>> pools) {
        for (CompletableFuture<CandidatePool> pool : pools) {
            if (pool != null && !pool.isDone()) {
                pool.cancel(true);
            }
        }
    }

    private void enterStage(ScriptSection section, CompositionStage stage) {
        logger.debug("Section {} ({}) -> {}", section.index(), section.label(), stage);
    }

    private double totalDuration(List<ScriptSection> ordered) {
        return ordered.stream().mapToDouble(ScriptSection::targetDuration).sum();
    }

    private record CandidatePool(List<Asset> assets, String failureMessage) {
    }

    private record SlotResolution(
            Asset asset,
            ScoredCandidate selection,
            ResolutionStatus status,
            List<SectionDeficiency> deficiencies) {
    }
}
