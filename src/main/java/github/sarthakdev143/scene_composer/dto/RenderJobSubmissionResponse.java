package github.sarthakdev143.scene_composer.dto;

import github.sarthakdev143.scene_composer.model.RenderJobState;

public record RenderJobSubmissionResponse(
        String jobId,
        RenderJobState state,
        String message) {
}
