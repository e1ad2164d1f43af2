package github.sarthakdev143.scene_composer.controller;

import github.sarthakdev143.scene_composer.dto.CompositionRequest;
import github.sarthakdev143.scene_composer.dto.RenderJobRequest;
import github.sarthakdev143.scene_composer.dto.RenderJobSubmissionResponse;
import github.sarthakdev143.scene_composer.dto.SectionRequest;
import github.sarthakdev143.scene_composer.model.ComposeOptions;
import github.sarthakdev143.scene_composer.model.OutputPreset;
import github.sarthakdev143.scene_composer.model.RenderJobState;
import github.sarthakdev143.scene_composer.model.ScriptSection;
import github.sarthakdev143.scene_composer.model.SectionLabel;
import github.sarthakdev143.scene_composer.service.CompositionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@RestController
@RequestMapping("/api/composition")
public class CompositionController {

    private static final Logger logger = LoggerFactory.getLogger(CompositionController.class);
    private static final int MAX_NARRATION_LENGTH = 5000;

    private final CompositionService compositionService;

    public CompositionController(CompositionService compositionService) {
        this.compositionService = compositionService;
    }

    @PostMapping("/plan")
    public ResponseEntity<?> plan(@RequestBody CompositionRequest request) {
        return handle("compose timeline", () -> {
            List<ScriptSection> sections = toSections(request);
            return ResponseEntity.ok(compositionService.compose(sections, toOptions(request)));
        });
    }

    @PostMapping("/preview")
    public ResponseEntity<?> preview(@RequestBody CompositionRequest request) {
        return handle("preview composition", () -> {
            List<ScriptSection> sections = toSections(request);
            return ResponseEntity.ok(compositionService.preview(sections, toOptions(request)));
        });
    }

    @PostMapping("/transitions")
    public ResponseEntity<?> transitions(@RequestBody CompositionRequest request) {
        return handle("preview transitions",
                () -> ResponseEntity.ok(compositionService.previewTransitions(toSections(request))));
    }

    @PostMapping("/render")
    public ResponseEntity<?> render(@RequestBody RenderJobRequest request) {
        return handle("submit render job", () -> {
            if (request == null || request.composition() == null) {
                throw new IllegalArgumentException("composition is required.");
            }
            List<ScriptSection> sections = toSections(request.composition());
            ComposeOptions options = toOptions(request.composition());
            OutputPreset preset = OutputPreset.fromInput(request.outputPreset(), null);
            Path audioPath = resolveAudioPath(request.audioPath());

            String jobId = compositionService.submitRenderJob(sections, options, preset, audioPath);
            return ResponseEntity.accepted()
                    .body(new RenderJobSubmissionResponse(
                            jobId,
                            RenderJobState.QUEUED,
                            "Render job accepted. Poll /api/composition/render/{jobId} for progress."));
        });
    }

    @GetMapping("/render/{jobId}")
    public ResponseEntity<?> getRenderStatus(@PathVariable String jobId) {
        return compositionService.getRenderJobStatus(jobId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body("Job not found for id: " + jobId));
    }

    private ResponseEntity<?> handle(String action, RequestHandler handler) {
        try {
            return handler.handle();
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (Exception e) {
            logger.error("Failed to {}", action, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to " + action + ". Please try again.");
        }
    }

    private List<ScriptSection> toSections(CompositionRequest request) {
        if (request == null || request.sections() == null || request.sections().isEmpty()) {
            throw new IllegalArgumentException("sections must contain at least one section.");
        }

        List<ScriptSection> sections = new ArrayList<>();
        for (int position = 0; position < request.sections().size(); position++) {
            SectionRequest section = request.sections().get(position);
            if (section == null) {
                throw new IllegalArgumentException("sections[" + position + "] must not be null.");
            }
            if (section.targetDuration() == null) {
                throw new IllegalArgumentException("sections[" + position + "].targetDuration is required.");
            }
            if (section.narration() != null && section.narration().length() > MAX_NARRATION_LENGTH) {
                throw new IllegalArgumentException(
                        "sections[" + position + "].narration must be at most " + MAX_NARRATION_LENGTH + " characters.");
            }

            sections.add(new ScriptSection(
                    section.index() == null ? position : section.index(),
                    SectionLabel.resolve(section.label(), section.name()),
                    section.name(),
                    section.narration(),
                    section.visualHint(),
                    section.targetDuration(),
                    Boolean.TRUE.equals(section.staticVisual())));
        }
        return sections;
    }

    private ComposeOptions toOptions(CompositionRequest request) {
        return compositionService.resolveOptions(
                request.minimumScore(),
                request.manualOverrides(),
                request.placeholderAssetId(),
                request.candidateLimit(),
                request.strictKindMatching());
    }

    private Path resolveAudioPath(String audioPathInput) {
        if (audioPathInput == null || audioPathInput.isBlank()) {
            return null;
        }
        Path audioPath = Path.of(audioPathInput.trim());
        if (!Files.isRegularFile(audioPath) || !Files.isReadable(audioPath)) {
            throw new IllegalArgumentException("audioPath must point to a readable file.");
        }
        return audioPath;
    }

    @FunctionalInterface
    private interface RequestHandler {

        ResponseEntity<?> handle() throws Exception;
    }
}
