package github.sarthakdev143.scene_composer.service;

import github.sarthakdev143.scene_composer.model.OutputPreset;
import github.sarthakdev143.scene_composer.model.TimelinePlan;

import java.io.IOException;
import java.nio.file.Path;

public interface TimelineRenderer {

    void render(TimelinePlan plan, OutputPreset preset, Path audioPath, Path outputVideoPath)
            throws IOException, InterruptedException;
}
