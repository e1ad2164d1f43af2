package github.sarthakdev143.scene_composer.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

@Component
@ConditionalOnProperty(name = "scene-composer.preflight.enabled", havingValue = "true", matchIfMissing = true)
public class StartupPreflightChecks implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(StartupPreflightChecks.class);
    private static final String FFMPEG_PATH_ENV = "FFMPEG_PATH";
    private static final String DEFAULT_FFMPEG_BINARY = "ffmpeg";
    private static final int FFMPEG_CHECK_TIMEOUT_SECONDS = 10;

    private final SceneComposerProperties properties;

    public StartupPreflightChecks(SceneComposerProperties properties) {
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        checkFfmpegConfiguration();
        checkOutputDirectory();
        checkAssetSources();
    }

    private void checkFfmpegConfiguration() {
        String configuredPath = System.getenv(FFMPEG_PATH_ENV);
        if (configuredPath != null && !configuredPath.isBlank()) {
            Path ffmpegPath = Path.of(configuredPath);
            if (!Files.isRegularFile(ffmpegPath)) {
                throw new IllegalStateException(
                        "FFmpeg binary not found at " + ffmpegPath.toAbsolutePath()
                                + ". Set " + FFMPEG_PATH_ENV + " to a valid ffmpeg executable path.");
            }
            return;
        }

        try {
            Process process = new ProcessBuilder(DEFAULT_FFMPEG_BINARY, "-version")
                    .redirectErrorStream(true)
                    .start();
            boolean finished = process.waitFor(FFMPEG_CHECK_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (!finished || process.exitValue() != 0) {
                throw new IllegalStateException(
                        "FFmpeg is not available on PATH. Install FFmpeg or set " + FFMPEG_PATH_ENV + ".");
            }
        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new IllegalStateException(
                    "FFmpeg is not available on PATH. Install FFmpeg or set " + FFMPEG_PATH_ENV + ".",
                    e);
        }
    }

    private void checkOutputDirectory() {
        Path outputDir = Path.of(properties.render().outputDir());
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException(
                    "Render output directory cannot be created at " + outputDir.toAbsolutePath() + ".",
                    e);
        }
        if (!Files.isWritable(outputDir)) {
            throw new IllegalStateException(
                    "Render output directory is not writable at " + outputDir.toAbsolutePath() + ".");
        }
    }

    private void checkAssetSources() {
        if (properties.catalog().assets().isEmpty() && !properties.pexels().enabled()) {
            logger.warn("No asset catalog entries and Pexels search disabled; every section will lack candidates");
        }
    }
}
