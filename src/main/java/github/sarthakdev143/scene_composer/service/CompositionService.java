package github.sarthakdev143.scene_composer.service;

import github.sarthakdev143.scene_composer.model.ComposeOptions;
import github.sarthakdev143.scene_composer.model.CompositionPreview;
import github.sarthakdev143.scene_composer.model.OutputPreset;
import github.sarthakdev143.scene_composer.model.RenderJobStatus;
import github.sarthakdev143.scene_composer.model.ScriptSection;
import github.sarthakdev143.scene_composer.model.TimelinePlan;
import github.sarthakdev143.scene_composer.model.TransitionDecision;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface CompositionService {

    /**
     * Builds per-run options on top of the configured defaults. Null arguments keep the default.
     */
    ComposeOptions resolveOptions(
            Double minimumScore,
            Map<Integer, String> manualOverrides,
            String placeholderAssetId,
            Integer candidateLimit,
            Boolean strictKindMatching);

    TimelinePlan compose(List<ScriptSection> sections, ComposeOptions options);

    CompositionPreview preview(List<ScriptSection> sections, ComposeOptions options);

    List<TransitionDecision> previewTransitions(List<ScriptSection> sections);

    String submitRenderJob(
            List<ScriptSection> sections,
            ComposeOptions options,
            OutputPreset outputPreset,
            Path audioPath);

    Optional<RenderJobStatus> getRenderJobStatus(String jobId);
}
