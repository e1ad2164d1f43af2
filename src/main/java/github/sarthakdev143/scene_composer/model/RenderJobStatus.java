package github.sarthakdev143.scene_composer.model;

import java.time.Instant;

public record RenderJobStatus(
        String jobId,
        RenderJobState state,
        String message,
        Instant createdAt,
        Instant updatedAt,
        int sectionCount,
        boolean fullyResolved,
        String outputPath,
        String warningMessage) {
}
