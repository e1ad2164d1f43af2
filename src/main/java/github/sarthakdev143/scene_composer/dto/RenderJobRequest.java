package github.sarthakdev143.scene_composer.dto;

public record RenderJobRequest(
        CompositionRequest composition,
        String outputPreset,
        String audioPath) {
}
