package github.sarthakdev143.scene_composer.service.impl;

import github.sarthakdev143.scene_composer.composition.CompositionOrchestrator;
import github.sarthakdev143.scene_composer.config.SceneComposerProperties;
import github.sarthakdev143.scene_composer.model.Asset;
import github.sarthakdev143.scene_composer.model.ComposeOptions;
import github.sarthakdev143.scene_composer.model.CompositionPreview;
import github.sarthakdev143.scene_composer.model.OutputPreset;
import github.sarthakdev143.scene_composer.model.RenderJobState;
import github.sarthakdev143.scene_composer.model.RenderJobStatus;
import github.sarthakdev143.scene_composer.model.ResolutionStatus;
import github.sarthakdev143.scene_composer.model.ScriptSection;
import github.sarthakdev143.scene_composer.model.TimelinePlan;
import github.sarthakdev143.scene_composer.model.TransitionDecision;
import github.sarthakdev143.scene_composer.service.AssetPoolProvider;
import github.sarthakdev143.scene_composer.service.CompositionService;
import github.sarthakdev143.scene_composer.service.TimelineRenderer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class DefaultCompositionService implements CompositionService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultCompositionService.class);

    private final CompositionOrchestrator orchestrator;
    private final AssetPoolProvider assetPoolProvider;
    private final TimelineRenderer timelineRenderer;
    private final TaskExecutor taskExecutor;
    private final SceneComposerProperties properties;
    private final Map<String, RenderJobStatus> jobs = new ConcurrentHashMap<>();
    private final Counter missingAssetCounter;
    private final Counter placeholderCounter;
    private final Counter renderFailureCounter;

    public DefaultCompositionService(
            CompositionOrchestrator orchestrator,
            AssetPoolProvider assetPoolProvider,
            TimelineRenderer timelineRenderer,
            TaskExecutor taskExecutor,
            SceneComposerProperties properties,
            MeterRegistry meterRegistry) {
        this.orchestrator = orchestrator;
        this.assetPoolProvider = assetPoolProvider;
        this.timelineRenderer = timelineRenderer;
        this.taskExecutor = taskExecutor;
        this.properties = properties;
        this.missingAssetCounter = meterRegistry.counter("scene_composer.sections.missing_asset");
        this.placeholderCounter = meterRegistry.counter("scene_composer.sections.placeholder");
        this.renderFailureCounter = meterRegistry.counter("scene_composer.render.failures");
    }

    @Override
    public ComposeOptions resolveOptions(
            Double minimumScore,
            Map<Integer, String> manualOverrides,
            String placeholderAssetId,
            Integer candidateLimit,
            Boolean strictKindMatching) {
        SceneComposerProperties.Composition defaults = properties.composition();

        String placeholderId = placeholderAssetId == null || placeholderAssetId.isBlank()
                ? defaults.placeholderAssetId()
                : placeholderAssetId.trim();
        Asset placeholder = null;
        if (placeholderId != null && !placeholderId.isBlank()) {
            placeholder = assetPoolProvider.findById(placeholderId)
                    .orElseThrow(() -> new IllegalArgumentException(
                            "placeholderAssetId " + placeholderId + " was not found."));
        }

        return new ComposeOptions(
                minimumScore == null ? defaults.minimumScore() : minimumScore,
                manualOverrides,
                placeholder,
                candidateLimit == null ? defaults.candidateLimit() : candidateLimit,
                strictKindMatching == null ? defaults.strictKindMatching() : strictKindMatching);
    }

    @Override
    public TimelinePlan compose(List<ScriptSection> sections, ComposeOptions options) {
        TimelinePlan plan = orchestrator.compose(sections, options);
        long missing = plan.countByStatus(ResolutionStatus.MISSING);
        long placeholders = plan.countByStatus(ResolutionStatus.PLACEHOLDER);
        if (missing > 0) {
            missingAssetCounter.increment(missing);
        }
        if (placeholders > 0) {
            placeholderCounter.increment(placeholders);
        }
        return plan;
    }

    @Override
    public CompositionPreview preview(List<ScriptSection> sections, ComposeOptions options) {
        return orchestrator.preview(sections, options);
    }

    @Override
    public List<TransitionDecision> previewTransitions(List<ScriptSection> sections) {
        return orchestrator.previewTransitions(sections);
    }

    @Override
    public String submitRenderJob(
            List<ScriptSection> sections,
            ComposeOptions options,
            OutputPreset outputPreset,
            Path audioPath) {
        TimelinePlan plan = compose(sections, options);
        OutputPreset preset = outputPreset == null ? properties.render().defaultPreset() : outputPreset;

        String jobId = UUID.randomUUID().toString();
        Instant now = Instant.now();
        jobs.put(jobId, new RenderJobStatus(
                jobId,
                RenderJobState.QUEUED,
                "Render job queued.",
                now,
                now,
                plan.entries().size(),
                plan.isFullyResolved(),
                null,
                null));

        logger.info(
                "Accepted render job {} sections={} fullyResolved={} preset={} hasAudio={}",
                jobId,
                plan.entries().size(),
                plan.isFullyResolved(),
                preset,
                audioPath != null);

        taskExecutor.execute(() -> processJob(jobId, plan, preset, audioPath));
        return jobId;
    }

    @Override
    public Optional<RenderJobStatus> getRenderJobStatus(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    private void processJob(String jobId, TimelinePlan plan, OutputPreset preset, Path audioPath) {
        updateJobState(jobId, RenderJobState.PROCESSING, "Rendering timeline.");

        try {
            Path outputDir = Path.of(properties.render().outputDir());
            Files.createDirectories(outputDir);
            Path outputVideoPath = outputDir.resolve(jobId + ".mp4");

            timelineRenderer.render(plan, preset, audioPath, outputVideoPath);

            String warningMessage = plan.isFullyResolved()
                    ? null
                    : plan.deficiencies().size() + " section deficiencies; "
                            + plan.countByStatus(ResolutionStatus.MISSING) + " sections rendered blank and "
                            + plan.countByStatus(ResolutionStatus.PLACEHOLDER) + " with a placeholder.";
            markJobCompleted(jobId, outputVideoPath.toAbsolutePath().toString(), warningMessage);
            logger.info("Completed render job {} output={} warning={}", jobId, outputVideoPath, warningMessage != null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            renderFailureCounter.increment();
            logger.error("Render job {} interrupted", jobId, e);
            markJobFailed(jobId, "Render interrupted.");
        } catch (Exception e) {
            renderFailureCounter.increment();
            logger.error("Render job {} failed", jobId, e);
            markJobFailed(jobId, "Render failed. Check server logs.");
        }
    }

    private void updateJobState(String jobId, RenderJobState state, String message) {
        jobs.computeIfPresent(jobId, (ignored, current) -> new RenderJobStatus(
                current.jobId(),
                state,
                message,
                current.createdAt(),
                Instant.now(),
                current.sectionCount(),
                current.fullyResolved(),
                current.outputPath(),
                current.warningMessage()));
    }

    private void markJobCompleted(String jobId, String outputPath, String warningMessage) {
        String completionMessage = warningMessage == null
                ? "Timeline rendered successfully."
                : "Timeline rendered with warnings.";

        jobs.computeIfPresent(jobId, (ignored, current) -> new RenderJobStatus(
                current.jobId(),
                RenderJobState.COMPLETED,
                completionMessage,
                current.createdAt(),
                Instant.now(),
                current.sectionCount(),
                current.fullyResolved(),
                outputPath,
                warningMessage));
    }

    private void markJobFailed(String jobId, String message) {
        jobs.computeIfPresent(jobId, (ignored, current) -> new RenderJobStatus(
                current.jobId(),
                RenderJobState.FAILED,
                message,
                current.createdAt(),
                Instant.now(),
                current.sectionCount(),
                current.fullyResolved(),
                current.outputPath(),
                current.warningMessage()));
    }
}
