package github.sarthakdev143.scene_composer.integration.video;

import github.sarthakdev143.scene_composer.model.Asset;
import github.sarthakdev143.scene_composer.model.AssetKind;
import github.sarthakdev143.scene_composer.model.MotionPlan;
import github.sarthakdev143.scene_composer.model.OutputPreset;
import github.sarthakdev143.scene_composer.model.TimelineEntry;
import github.sarthakdev143.scene_composer.model.TimelinePlan;
import github.sarthakdev143.scene_composer.model.TransitionDecision;
import github.sarthakdev143.scene_composer.model.TransitionEffect;
import github.sarthakdev143.scene_composer.service.TimelineRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Renders a {@link TimelinePlan} with the FFmpeg command line: one clip per entry, joined with
 * {@code xfade} where the plan carries transitions, then muxed with the narration track.
 */
@Component
public class FfmpegTimelineRenderer implements TimelineRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FfmpegTimelineRenderer.class);
    private static final String FFMPEG_PATH_ENV = "FFMPEG_PATH";
    private static final String DEFAULT_FFMPEG_BINARY = "ffmpeg";
    private static final int FRAME_RATE = 30;
    private static final double CUT_TRANSITION_DURATION_SECONDS = 0.001;
    private static final double EPSILON = 1e-9;
    private static final double MIN_PAN_HEADROOM_SCALE = 1.15;
    private static final double MAX_PAN_HEADROOM_SCALE = 2.0;

    @Override
    public void render(TimelinePlan plan, OutputPreset preset, Path audioPath, Path outputVideoPath)
            throws IOException, InterruptedException {
        if (plan.entries().isEmpty()) {
            throw new IllegalArgumentException("Timeline plan must include at least one entry.");
        }

        Path workDir = Files.createTempDirectory("scene-composer-render-");
        List<Path> slotClips = new ArrayList<>();
        Path visualTrack = workDir.resolve("visual.mp4");

        try {
            for (int position = 0; position < plan.entries().size(); position++) {
                TimelineEntry entry = plan.entries().get(position);
                Path slotClip = workDir.resolve("slot-" + entry.index() + ".mp4");
                runCommand(buildSlotCommand(entry, preset, slotClip), "render section " + entry.index());
                slotClips.add(slotClip);
            }

            if (slotClips.size() == 1) {
                Files.copy(slotClips.get(0), visualTrack);
            } else {
                boolean hasTransitions = plan.entries()
                        .stream()
                        .skip(1)
                        .anyMatch(entry -> !isCut(entry.inboundTransition()));

                List<String> combineCommand = hasTransitions
                        ? buildVisualTransitionCommand(slotClips, plan.entries(), visualTrack)
                        : buildVisualConcatCommand(slotClips, visualTrack);
                runCommand(combineCommand, "combine section clips");
            }

            if (audioPath == null) {
                Files.copy(visualTrack, outputVideoPath, StandardCopyOption.REPLACE_EXISTING);
            } else {
                runCommand(buildAudioMuxCommand(audioPath, visualTrack, outputVideoPath), "mux narration audio");
            }
        } finally {
            deleteRecursively(workDir);
        }
    }

    List<String> buildSlotCommand(TimelineEntry entry, OutputPreset preset, Path outputPath) {
        Asset asset = entry.asset();
        if (asset == null) {
            return buildBlankSlotCommand(entry.section().targetDuration(), preset, outputPath);
        }
        if (asset.location() == null || asset.location().isBlank()) {
            throw new IllegalArgumentException("Asset " + asset.id() + " has no location to render from.");
        }
        if (asset.kind() == AssetKind.VIDEO) {
            return buildVideoSlotCommand(asset.location(), entry.section().targetDuration(), preset, outputPath);
        }
        return buildImageSlotCommand(
                asset.location(),
                entry.section().targetDuration(),
                entry.motionPlan(),
                preset,
                outputPath);
    }

    List<String> buildImageSlotCommand(
            String location,
            double durationSeconds,
            MotionPlan motionPlan,
            OutputPreset preset,
            Path outputPath) {
        List<String> command = new ArrayList<>();
        command.add(resolveFfmpegBinary());
        command.add("-y");
        command.add("-loop");
        command.add("1");
        command.add("-i");
        command.add(location);
        command.add("-t");
        command.add(formatSeconds(durationSeconds));
        command.add("-vf");
        command.add(buildImageFilter(motionPlan, durationSeconds, preset));
        command.add("-r");
        command.add(String.valueOf(FRAME_RATE));
        command.add("-an");
        addEncoderArguments(command);
        command.add(outputPath.toString());
        return command;
    }

    List<String> buildVideoSlotCommand(String location, double durationSeconds, OutputPreset preset, Path outputPath) {
        List<String> command = new ArrayList<>();
        command.add(resolveFfmpegBinary());
        command.add("-y");
        command.add("-stream_loop");
        command.add("-1");
        command.add("-t");
        command.add(formatSeconds(durationSeconds));
        command.add("-i");
        command.add(location);
        command.add("-vf");
        command.add(scalePadFilter(preset));
        command.add("-an");
        command.add("-r");
        command.add(String.valueOf(FRAME_RATE));
        addEncoderArguments(command);
        command.add(outputPath.toString());
        return command;
    }

    List<String> buildBlankSlotCommand(double durationSeconds, OutputPreset preset, Path outputPath) {
        List<String> command = new ArrayList<>();
        command.add(resolveFfmpegBinary());
        command.add("-y");
        command.add("-f");
        command.add("lavfi");
        command.add("-i");
        command.add("color=c=black:s=" + preset.width() + "x" + preset.height() + ":r=" + FRAME_RATE);
        command.add("-t");
        command.add(formatSeconds(durationSeconds));
        command.add("-an");
        addEncoderArguments(command);
        command.add(outputPath.toString());
        return command;
    }

    List<String> buildVisualConcatCommand(List<Path> slotClips, Path outputPath) {
        List<String> command = new ArrayList<>();
        command.add(resolveFfmpegBinary());
        command.add("-y");
        for (Path slotClip : slotClips) {
            command.add("-i");
            command.add(slotClip.toString());
        }

        StringBuilder filterBuilder = new StringBuilder();
        for (int index = 0; index < slotClips.size(); index++) {
            filterBuilder.append("[").append(index).append(":v]");
        }
        filterBuilder.append("concat=n=").append(slotClips.size()).append(":v=1:a=0[v]");

        command.add("-filter_complex");
        command.add(filterBuilder.toString());
        command.add("-map");
        command.add("[v]");
        addEncoderArguments(command);
        command.add(outputPath.toString());
        return command;
    }

    /**
     * Chains {@code xfade} filters. Each offset is the running output length minus the incoming
     * transition; transitions are clamped to half of the shorter neighbouring slot.
     */
    List<String> buildVisualTransitionCommand(List<Path> slotClips, List<TimelineEntry> entries, Path outputPath) {
        List<String> command = new ArrayList<>();
        command.add(resolveFfmpegBinary());
        command.add("-y");
        for (Path slotClip : slotClips) {
            command.add("-i");
            command.add(slotClip.toString());
        }

        String currentLabel = "[0:v]";
        double accumulatedDuration = entries.get(0).section().targetDuration();
        StringBuilder filterComplex = new StringBuilder();

        for (int index = 1; index < entries.size(); index++) {
            TimelineEntry entry = entries.get(index);
            double slotDuration = entry.section().targetDuration();
            double previousDuration = entries.get(index - 1).section().targetDuration();
            TransitionDecision transition = entry.inboundTransition();

            String xfadeName = TransitionEffect.CROSSFADE.xfadeName();
            double transitionDuration = CUT_TRANSITION_DURATION_SECONDS;
            if (!isCut(transition)) {
                xfadeName = transition.effect().xfadeName();
                transitionDuration = Math.min(transition.durationSeconds(), Math.min(slotDuration, previousDuration) / 2.0);
            }
            double offset = Math.max(accumulatedDuration - transitionDuration, 0.0);

            String outputLabel = "[xf" + index + "]";
            if (filterComplex.length() > 0) {
                filterComplex.append(";");
            }
            filterComplex.append(currentLabel)
                    .append("[").append(index).append(":v]")
                    .append("xfade=transition=").append(xfadeName)
                    .append(":duration=").append(formatSeconds(transitionDuration))
                    .append(":offset=").append(formatSeconds(offset))
                    .append(outputLabel);

            currentLabel = outputLabel;
            accumulatedDuration = accumulatedDuration + slotDuration - transitionDuration;
        }

        command.add("-filter_complex");
        command.add(filterComplex.toString());
        command.add("-map");
        command.add(currentLabel);
        addEncoderArguments(command);
        command.add(outputPath.toString());
        return command;
    }

    /**
     * Narration is padded with silence so a short recording never truncates the picture.
     */
    List<String> buildAudioMuxCommand(Path audioPath, Path visualTrackPath, Path outputVideoPath) {
        return List.of(
                resolveFfmpegBinary(),
                "-y",
                "-i",
                visualTrackPath.toString(),
                "-i",
                audioPath.toString(),
                "-map",
                "0:v:0",
                "-map",
                "1:a:0",
                "-af",
                "apad",
                "-c:v",
                "copy",
                "-c:a",
                "aac",
                "-b:a",
                "192k",
                "-shortest",
                outputVideoPath.toString());
    }

    String buildImageFilter(MotionPlan motionPlan, double durationSeconds, OutputPreset preset) {
        String scalePad = scalePadFilter(preset);
        if (motionPlan == null) {
            return scalePad;
        }
        return scalePad + "," + buildZoompanFilter(motionPlan, durationSeconds, preset);
    }

    /**
     * Linear interpolation of zoom and pan over the slot, driven by the output frame number.
     *
     * <p>zoompan clamps the crop window to the frame, so a pan at zoom 1.0 has nowhere to move.
     * Panning plans that never zoom in far enough are rendered with extra zoom.
     */
    String buildZoompanFilter(MotionPlan motionPlan, double durationSeconds, OutputPreset preset) {
        long frames = Math.max(1L, Math.round(durationSeconds * FRAME_RATE));
        String progress = "on/" + frames;
        double startScale = motionPlan.startScale();
        double endScale = motionPlan.endScale();
        if (pans(motionPlan)) {
            double headroom = panHeadroomScale(motionPlan);
            double widest = Math.max(startScale, endScale);
            if (widest > EPSILON && widest < headroom) {
                startScale = startScale * headroom / widest;
                endScale = endScale * headroom / widest;
            }
        }
        String zoom = interpolate(startScale, endScale, progress);
        String panX = interpolate(motionPlan.startOffset().x(), motionPlan.endOffset().x(), progress);
        String panY = interpolate(motionPlan.startOffset().y(), motionPlan.endOffset().y(), progress);

        return "zoompan=z='" + zoom + "'"
                + ":x='iw/2-(iw/zoom/2)+(" + panX + ")*iw'"
                + ":y='ih/2-(ih/zoom/2)+(" + panY + ")*ih'"
                + ":d=1:fps=" + FRAME_RATE
                + ":s=" + preset.width() + "x" + preset.height();
    }

    private boolean pans(MotionPlan motionPlan) {
        return Math.abs(motionPlan.endOffset().x() - motionPlan.startOffset().x()) > EPSILON
                || Math.abs(motionPlan.endOffset().y() - motionPlan.startOffset().y()) > EPSILON;
    }

    // Zoom at which the crop window can reach the largest offset on either side of center.
    private double panHeadroomScale(MotionPlan motionPlan) {
        double largestOffset = Math.max(
                Math.max(Math.abs(motionPlan.startOffset().x()), Math.abs(motionPlan.startOffset().y())),
                Math.max(Math.abs(motionPlan.endOffset().x()), Math.abs(motionPlan.endOffset().y())));
        double visibleFraction = 1.0 - 2.0 * largestOffset;
        if (visibleFraction <= 1.0 / MAX_PAN_HEADROOM_SCALE) {
            return MAX_PAN_HEADROOM_SCALE;
        }
        return Math.max(MIN_PAN_HEADROOM_SCALE, 1.0 / visibleFraction);
    }

    private String interpolate(double start, double end, String progress) {
        if (Math.abs(end - start) <= EPSILON) {
            return formatDecimal(start);
        }
        return formatDecimal(start) + "+(" + formatDecimal(end - start) + ")*" + progress;
    }

    private String scalePadFilter(OutputPreset preset) {
        int width = preset.width();
        int height = preset.height();
        return "scale="
                + width
                + ":"
                + height
                + ":force_original_aspect_ratio=decrease,pad="
                + width
                + ":"
                + height
                + ":(ow-iw)/2:(oh-ih)/2:black,setsar=1";
    }

    private boolean isCut(TransitionDecision transition) {
        return transition == null
                || transition.effect() == TransitionEffect.NONE
                || transition.durationSeconds() <= EPSILON;
    }

    private void addEncoderArguments(List<String> command) {
        command.add("-c:v");
        command.add("libx264");
        command.add("-preset");
        command.add("veryfast");
        command.add("-crf");
        command.add("23");
        command.add("-pix_fmt");
        command.add("yuv420p");
    }

    private void runCommand(List<String> command, String stage) throws IOException, InterruptedException {
        logger.info("Running FFmpeg command for stage {}: {}", stage, String.join(" ", command));
        Process process = new ProcessBuilder(command)
                .redirectErrorStream(true)
                .start();

        StringBuilder output = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(process.getInputStream()))) {
            String line;
            while ((line = reader.readLine()) != null) {
                output.append(line).append(System.lineSeparator());
            }
        }

        boolean finished = process.waitFor(10, TimeUnit.MINUTES);
        if (!finished) {
            process.destroyForcibly();
            throw new IOException("FFmpeg timed out during stage: " + stage);
        }

        if (process.exitValue() != 0) {
            throw new IOException(
                    "FFmpeg failed during stage "
                            + stage
                            + " with exit code "
                            + process.exitValue()
                            + ". Output: "
                            + output);
        }
    }

    private String formatSeconds(double seconds) {
        return String.format(Locale.ROOT, "%.3f", seconds);
    }

    private String formatDecimal(double value) {
        return String.format(Locale.ROOT, "%.4f", value);
    }

    private String resolveFfmpegBinary() {
        String configuredPath = System.getenv(FFMPEG_PATH_ENV);
        if (configuredPath != null && !configuredPath.isBlank()) {
            return configuredPath;
        }
        return DEFAULT_FFMPEG_BINARY;
    }

    private void deleteRecursively(Path directory) {
        try {
            if (Files.notExists(directory)) {
                return;
            }
            try (var pathStream = Files.walk(directory)) {
                pathStream
                        .sorted((left, right) -> right.compareTo(left))
                        .forEach(this::deleteIfExists);
            }
        } catch (IOException e) {
            logger.warn("Could not clean up render directory {}", directory, e);
        }
    }

    private void deleteIfExists(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.debug("Could not delete {}", path, e);
        }
    }
}
