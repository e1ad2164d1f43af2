package github.sarthakdev143.scene_composer.composition;

import github.sarthakdev143.scene_composer.model.Asset;
import github.sarthakdev143.scene_composer.model.AssetKind;
import github.sarthakdev143.scene_composer.model.ComposeOptions;
import github.sarthakdev143.scene_composer.model.CompositionPreview;
import github.sarthakdev143.scene_composer.model.DeficiencyType;
import github.sarthakdev143.scene_composer.model.MotionPattern;
import github.sarthakdev143.scene_composer.model.ResolutionStatus;
import github.sarthakdev143.scene_composer.model.ScoreFactor;
import github.sarthakdev143.scene_composer.model.ScriptSection;
import github.sarthakdev143.scene_composer.model.SectionDeficiency;
import github.sarthakdev143.scene_composer.model.SectionLabel;
import github.sarthakdev143.scene_composer.model.TimelineEntry;
import github.sarthakdev143.scene_composer.model.TimelinePlan;
import github.sarthakdev143.scene_composer.model.TransitionDecision;
import github.sarthakdev143.scene_composer.model.TransitionEffect;
import github.sarthakdev143.scene_composer.model.rules.MotionBands;
import github.sarthakdev143.scene_composer.model.rules.ProfileRules;
import github.sarthakdev143.scene_composer.model.rules.ScoringWeights;
import github.sarthakdev143.scene_composer.model.rules.TransitionRules;
import github.sarthakdev143.scene_composer.service.AssetPoolProvider;
import github.sarthakdev143.scene_composer.service.AssetSearchException;
import github.sarthakdev143.scene_composer.service.impl.ScriptValidator;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskExecutor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CompositionOrchestratorTest {

    private static final Asset GALAXY_CLIP = new Asset("galaxy-clip", AssetKind.VIDEO, Set.of("galaxy", "space"), null, 0);
    private static final Asset STARS_STILL = new Asset("stars-still", AssetKind.IMAGE, Set.of("stars", "basics"), null, 0);
    private static final Asset ROCKET_LAUNCH = new Asset(
            "rocket-launch",
            AssetKind.VIDEO,
            Set.of("rockets", "orbit", "rocket"),
            null,
            0);
    private static final Asset BRAND_CARD = new Asset("brand-card", AssetKind.IMAGE, Set.of("brand"), null, 0);

    private static final List<ScriptSection> SCRIPT = List.of(
            new ScriptSection(0, SectionLabel.HOOK, "Explore the galaxy and its amazing secrets", 4.0),
            new ScriptSection(1, SectionLabel.BACKGROUND, "The basics of stars", 6.0),
            new ScriptSection(2, SectionLabel.MAIN_CONTENT, "How rockets reach orbit", 8.0));

    private final TaskExecutor directExecutor = Runnable::run;

    @Test
    void composeSelectsBestAssetsAndPlansMotionAndTransitions() {
        InMemoryAssetPool pool = new InMemoryAssetPool(List.of(GALAXY_CLIP, STARS_STILL, ROCKET_LAUNCH));

        TimelinePlan plan = orchestrator(pool, directExecutor).compose(SCRIPT, ComposeOptions.defaults());

        assertThat(plan.entries()).extracting(entry -> entry.asset().id())
                .containsExactly("galaxy-clip", "stars-still", "rocket-launch");
        assertThat(plan.entries()).extracting(TimelineEntry::status)
                .containsOnly(ResolutionStatus.RESOLVED);
        assertThat(plan.isFullyResolved()).isTrue();
        assertThat(plan.deficiencies()).isEmpty();
        assertThat(plan.totalDurationSeconds()).isEqualTo(18.0);

        TimelineEntry hook = plan.entries().get(0);
        assertThat(hook.selection().totalScore()).isEqualTo(50.0);
        assertThat(hook.motionPlan()).isNull();
        assertThat(hook.inboundTransition()).isNull();

        TimelineEntry background = plan.entries().get(1);
        assertThat(background.selection().totalScore()).isEqualTo(70.0);
        assertThat(background.motionPlan().pattern()).isEqualTo(MotionPattern.GENTLE_ZOOM_OUT);
        assertThat(background.motionPlan().durationSeconds()).isEqualTo(6.0);
        assertThat(background.inboundTransition().effect()).isEqualTo(TransitionEffect.FADE);

        TimelineEntry main = plan.entries().get(2);
        assertThat(main.selection().totalScore()).isEqualTo(90.0);
        assertThat(main.inboundTransition().effect()).isEqualTo(TransitionEffect.ZOOM_IN);
        assertThat(main.inboundTransition().fromIndex()).isEqualTo(1);
    }

    @Test
    void entriesFollowSectionIndexRegardlessOfInputOrder() {
        InMemoryAssetPool pool = new InMemoryAssetPool(List.of(GALAXY_CLIP, STARS_STILL, ROCKET_LAUNCH));
        List<ScriptSection> shuffled = List.of(SCRIPT.get(2), SCRIPT.get(0), SCRIPT.get(1));

        TimelinePlan plan = orchestrator(pool, directExecutor).compose(shuffled, null);

        assertThat(plan.entries()).extracting(TimelineEntry::index).containsExactly(0, 1, 2);
    }

    @Test
    void concurrentPrefetchGivesTheSamePlanAsSequentialRun() {
        InMemoryAssetPool pool = new InMemoryAssetPool(List.of(GALAXY_CLIP, STARS_STILL, ROCKET_LAUNCH));
        pool.randomDelay = true;
        ExecutorService executorService = Executors.newFixedThreadPool(4);
        try {
            TaskExecutor concurrentExecutor = executorService::execute;

            TimelinePlan sequential = orchestrator(pool, directExecutor).compose(SCRIPT, ComposeOptions.defaults());
            TimelinePlan concurrent = orchestrator(pool, concurrentExecutor).compose(SCRIPT, ComposeOptions.defaults());
            TimelinePlan repeated = orchestrator(pool, concurrentExecutor).compose(SCRIPT, ComposeOptions.defaults());

            assertThat(concurrent).isEqualTo(sequential);
            assertThat(repeated).isEqualTo(sequential);
        } finally {
            executorService.shutdownNow();
        }
    }

    @Test
    void sectionWithoutCandidatesIsMissingAndSkipsMotionAndTransition() {
        InMemoryAssetPool pool = new InMemoryAssetPool(List.of());

        TimelinePlan plan = orchestrator(pool, directExecutor).compose(SCRIPT, ComposeOptions.defaults());

        assertThat(plan.entries()).hasSize(3);
        for (TimelineEntry entry : plan.entries()) {
            assertThat(entry.status()).isEqualTo(ResolutionStatus.MISSING);
            assertThat(entry.asset()).isNull();
            assertThat(entry.motionPlan()).isNull();
            assertThat(entry.inboundTransition()).isNull();
            assertThat(entry.deficiencies()).extracting(SectionDeficiency::type)
                    .containsExactly(DeficiencyType.ASSET_MISSING);
        }
        assertThat(plan.deficiencies()).hasSize(3);
        assertThat(plan.isFullyResolved()).isFalse();
    }

    @Test
    void strictKindMatchingDropsWrongKindCandidates() {
        InMemoryAssetPool pool = new InMemoryAssetPool(List.of(STARS_STILL));
        ComposeOptions strict = new ComposeOptions(0.0, null, null, 5, true);
        List<ScriptSection> hookOnly = List.of(SCRIPT.get(0));

        TimelinePlan plan = orchestrator(pool, directExecutor).compose(hookOnly, strict);

        assertThat(plan.entries().get(0).status()).isEqualTo(ResolutionStatus.MISSING);
        assertThat(plan.entries().get(0).deficiencies().get(0).message()).contains("No candidate");
    }

    @Test
    void defaultOptionsLeaveFastSectionMissingWhenOnlyImagesMatch() {
        Asset galaxyStill = new Asset("galaxy-still", AssetKind.IMAGE, Set.of("galaxy", "explore"), null, 0);
        InMemoryAssetPool pool = new InMemoryAssetPool(List.of(galaxyStill));
        List<ScriptSection> hookOnly = List.of(new ScriptSection(0, SectionLabel.HOOK, "Explore the galaxy", 4.0));

        TimelinePlan plan = orchestrator(pool, directExecutor).compose(hookOnly, ComposeOptions.defaults());

        TimelineEntry hook = plan.entries().get(0);
        assertThat(hook.status()).isEqualTo(ResolutionStatus.MISSING);
        assertThat(hook.asset()).isNull();
        assertThat(hook.deficiencies()).extracting(SectionDeficiency::type)
                .containsExactly(DeficiencyType.ASSET_MISSING);
    }

    @Test
    void disablingKindMatchingLetsImagesServeFastSections() {
        Asset galaxyStill = new Asset("galaxy-still", AssetKind.IMAGE, Set.of("galaxy", "explore"), null, 0);
        InMemoryAssetPool pool = new InMemoryAssetPool(List.of(galaxyStill));
        List<ScriptSection> hookOnly = List.of(new ScriptSection(0, SectionLabel.HOOK, "Explore the galaxy", 4.0));
        ComposeOptions anyKind = new ComposeOptions(30.0, null, null, 5, false);

        TimelinePlan plan = orchestrator(pool, directExecutor).compose(hookOnly, anyKind);

        TimelineEntry hook = plan.entries().get(0);
        assertThat(hook.status()).isEqualTo(ResolutionStatus.RESOLVED);
        assertThat(hook.asset()).isEqualTo(galaxyStill);
        assertThat(hook.selection().contribution(ScoreFactor.TYPE_MATCH)).isZero();
    }

    @Test
    void candidatesBelowMinimumScoreUsePlaceholder() {
        InMemoryAssetPool pool = new InMemoryAssetPool(List.of(GALAXY_CLIP, STARS_STILL, ROCKET_LAUNCH));
        ComposeOptions options = new ComposeOptions(95.0, null, BRAND_CARD, 5, false);

        TimelinePlan plan = orchestrator(pool, directExecutor).compose(SCRIPT, options);

        assertThat(plan.entries()).extracting(TimelineEntry::status).containsOnly(ResolutionStatus.PLACEHOLDER);
        TimelineEntry hook = plan.entries().get(0);
        assertThat(hook.asset()).isEqualTo(BRAND_CARD);
        assertThat(hook.selection()).isNull();
        assertThat(hook.motionPlan().pattern()).isEqualTo(MotionPattern.FAST_ZOOM_IN);
        assertThat(hook.deficiencies().get(0).message()).contains("below minimum");
        assertThat(plan.entries().get(1).inboundTransition()).isNotNull();
        assertThat(plan.entries().get(2).inboundTransition()).isNotNull();
    }

    @Test
    void manualOverrideBypassesScoring() {
        Asset custom = new Asset("custom-1", AssetKind.IMAGE, Set.of(), null, 0);
        InMemoryAssetPool pool = new InMemoryAssetPool(List.of(GALAXY_CLIP, STARS_STILL, ROCKET_LAUNCH));
        pool.extraById.add(custom);
        ComposeOptions options = new ComposeOptions(30.0, Map.of(1, "custom-1"), null, 5, false);

        TimelinePlan plan = orchestrator(pool, directExecutor).compose(SCRIPT, options);

        TimelineEntry overridden = plan.entries().get(1);
        assertThat(overridden.status()).isEqualTo(ResolutionStatus.MANUAL_OVERRIDE);
        assertThat(overridden.asset()).isEqualTo(custom);
        assertThat(overridden.selection()).isNull();
        assertThat(overridden.motionPlan()).isNotNull();
        assertThat(pool.searchCount).isEqualTo(2);
    }

    @Test
    void unknownOverrideFallsBackToScoring() {
        InMemoryAssetPool pool = new InMemoryAssetPool(List.of(GALAXY_CLIP, STARS_STILL, ROCKET_LAUNCH));
        ComposeOptions options = new ComposeOptions(30.0, Map.of(2, "does-not-exist"), null, 5, false);

        TimelinePlan plan = orchestrator(pool, directExecutor).compose(SCRIPT, options);

        TimelineEntry entry = plan.entries().get(2);
        assertThat(entry.status()).isEqualTo(ResolutionStatus.RESOLVED);
        assertThat(entry.asset()).isEqualTo(ROCKET_LAUNCH);
        assertThat(entry.deficiencies()).extracting(SectionDeficiency::type)
                .containsExactly(DeficiencyType.OVERRIDE_NOT_FOUND);
        assertThat(plan.isFullyResolved()).isTrue();
    }

    @Test
    void providerFailureIsRecordedAndTreatedAsEmptyPool() {
        InMemoryAssetPool pool = new InMemoryAssetPool(List.of(GALAXY_CLIP, STARS_STILL, ROCKET_LAUNCH));
        pool.failingTerm = "stars";

        TimelinePlan plan = orchestrator(pool, directExecutor).compose(SCRIPT, ComposeOptions.defaults());

        TimelineEntry failed = plan.entries().get(1);
        assertThat(failed.status()).isEqualTo(ResolutionStatus.MISSING);
        assertThat(failed.deficiencies()).extracting(SectionDeficiency::type)
                .containsExactly(DeficiencyType.CANDIDATE_SEARCH_FAILED, DeficiencyType.ASSET_MISSING);
        assertThat(plan.entries().get(0).status()).isEqualTo(ResolutionStatus.RESOLVED);
        assertThat(plan.entries().get(2).status()).isEqualTo(ResolutionStatus.RESOLVED);
    }

    @Test
    void repeatedAssetEarnsUsageBonusWithinRun() {
        InMemoryAssetPool pool = new InMemoryAssetPool(List.of(STARS_STILL));
        List<ScriptSection> script = List.of(
                new ScriptSection(0, SectionLabel.BACKGROUND, "The basics of stars", 5.0),
                new ScriptSection(1, SectionLabel.BACKGROUND, "More basics of stars", 5.0));

        TimelinePlan plan = orchestrator(pool, directExecutor).compose(script, ComposeOptions.defaults());

        assertThat(plan.entries().get(0).selection().contribution(ScoreFactor.USAGE_BONUS)).isZero();
        assertThat(plan.entries().get(1).selection().contribution(ScoreFactor.USAGE_BONUS)).isEqualTo(1.0);
    }

    @Test
    void interruptedThreadCancelsComposition() {
        InMemoryAssetPool pool = new InMemoryAssetPool(List.of(GALAXY_CLIP));
        CompositionOrchestrator orchestrator = orchestrator(pool, directExecutor);

        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> orchestrator.compose(SCRIPT, ComposeOptions.defaults()))
                    .isInstanceOf(CompositionCancelledException.class);
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void invalidScriptIsRejectedBeforeProcessing() {
        InMemoryAssetPool pool = new InMemoryAssetPool(List.of(GALAXY_CLIP));
        CompositionOrchestrator orchestrator = orchestrator(pool, directExecutor);
        List<ScriptSection> duplicated = List.of(
                new ScriptSection(0, SectionLabel.HOOK, "a", 2.0),
                new ScriptSection(0, SectionLabel.SUMMARY, "b", 2.0));

        assertThatThrownBy(() -> orchestrator.compose(List.of(), null))
                .isInstanceOf(CompositionConfigurationException.class);
        assertThatThrownBy(() -> orchestrator.compose(duplicated, null))
                .isInstanceOf(CompositionConfigurationException.class)
                .hasMessageContaining("duplicated");
        assertThat(pool.searchCount).isZero();
    }

    @Test
    void previewReportsRankedCandidatesAndCoverage() {
        InMemoryAssetPool pool = new InMemoryAssetPool(List.of(GALAXY_CLIP, STARS_STILL, ROCKET_LAUNCH));
        ComposeOptions options = new ComposeOptions(30.0, null, null, 2, false);

        CompositionPreview preview = orchestrator(pool, directExecutor).preview(SCRIPT, options);

        assertThat(preview.sections()).hasSize(3);
        assertThat(preview.sections()).allSatisfy(section -> assertThat(section.rankedCandidates()).hasSize(2));
        assertThat(preview.sections().get(0).rankedCandidates().get(0).asset().id()).isEqualTo("galaxy-clip");
        assertThat(preview.sections()).extracting(section -> section.acceptableCount()).containsExactly(2, 3, 2);
        assertThat(preview.coverage().fullyCovered()).isEqualTo(1);
        assertThat(preview.coverage().partiallyCovered()).isEqualTo(2);
        assertThat(preview.coverage().notCovered()).isZero();
        assertThat(preview.coverage().coverageRate()).isEqualTo(33.33);
        assertThat(preview.estimatedDurationSeconds()).isEqualTo(18.0);
    }

    @Test
    void previewTransitionsResolvesEveryAdjacentPairWithoutSearching() {
        InMemoryAssetPool pool = new InMemoryAssetPool(List.of());

        List<TransitionDecision> decisions = orchestrator(pool, directExecutor).previewTransitions(SCRIPT);

        assertThat(decisions).extracting(TransitionDecision::effect)
                .containsExactly(TransitionEffect.FADE, TransitionEffect.ZOOM_IN);
        assertThat(pool.searchCount).isZero();
    }

    private CompositionOrchestrator orchestrator(AssetPoolProvider pool, TaskExecutor executor) {
        return new CompositionOrchestrator(
                new ScriptValidator(),
                new SectionProfiler(ProfileRules.defaults()),
                new AssetScorer(ScoringWeights.defaults()),
                new MotionGenerator(MotionBands.defaults()),
                new TransitionResolver(TransitionRules.defaults()),
                pool,
                executor);
    }

    private static final class InMemoryAssetPool implements AssetPoolProvider {

        private final List<Asset> assets;
        private final List<Asset> extraById = new ArrayList<>();
        private volatile String failingTerm;
        private volatile boolean randomDelay;
        private volatile int searchCount;

        private InMemoryAssetPool(List<Asset> assets) {
            this.assets = assets;
        }

        @Override
        public synchronized List<Asset> search(List<String> queryTerms, AssetKind preferredKind) {
            searchCount++;
            if (failingTerm != null && queryTerms.contains(failingTerm)) {
                throw new AssetSearchException("catalog offline");
            }
            if (randomDelay) {
                try {
                    Thread.sleep(ThreadLocalRandom.current().nextInt(20));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new AssetSearchException("interrupted", e);
                }
            }
            return assets;
        }

        @Override
        public Optional<Asset> findById(String assetId) {
            return extraById.stream()
                    .filter(asset -> asset.id().equals(assetId))
                    .findFirst();
        }
    }
}
