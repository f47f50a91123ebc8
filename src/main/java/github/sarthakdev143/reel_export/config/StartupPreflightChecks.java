package github.sarthakdev143.reel_export.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

@Component
@ConditionalOnProperty(name = "reel-export.preflight.enabled", havingValue = "true", matchIfMissing = true)
public class StartupPreflightChecks implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(StartupPreflightChecks.class);
    private static final int BINARY_CHECK_TIMEOUT_SECONDS = 10;

    private final ReelExportProperties properties;

    public StartupPreflightChecks(ReelExportProperties properties) {
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        checkBinary(properties.getFfmpegBinary(), "FFMPEG_PATH");
        checkBinary(properties.getFfprobeBinary(), "FFPROBE_PATH");
        createWorkspaceDirectories();
    }

    private void checkBinary(String binary, String environmentVariable) {
        try {
            Process process = new ProcessBuilder(binary, "-version")
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .start();
            boolean finished = process.waitFor(BINARY_CHECK_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
            }
            if (!finished || process.exitValue() != 0) {
                throw new IllegalStateException(
                        binary + " is not usable. Install FFmpeg or set " + environmentVariable + ".");
            }
        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new IllegalStateException(
                    binary + " is not available. Install FFmpeg or set " + environmentVariable + ".",
                    e);
        }
    }

    private void createWorkspaceDirectories() {
        for (Path directory : List.of(properties.uploadsPath(), properties.outputsPath(), properties.exportsPath())) {
            try {
                Files.createDirectories(directory);
            } catch (IOException e) {
                throw new IllegalStateException("Could not create workspace directory " + directory.toAbsolutePath() + ".", e);
            }
        }
        logger.info(
                "Workspace ready: uploads={} outputs={} exports={}",
                properties.uploadsPath().toAbsolutePath(),
                properties.outputsPath().toAbsolutePath(),
                properties.exportsPath().toAbsolutePath());
    }
}
