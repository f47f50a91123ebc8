package github.sarthakdev143.reel_export.integration.video;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import github.sarthakdev143.reel_export.config.ReelExportProperties;
import github.sarthakdev143.reel_export.model.timeline.MediaProbe;
import github.sarthakdev143.reel_export.service.MediaProber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Component
public class FfprobeMediaProber implements MediaProber {

    private static final Logger logger = LoggerFactory.getLogger(FfprobeMediaProber.class);
    private static final long OUTPUT_DRAIN_SECONDS = 5;

    private final String ffprobeBinary;
    private final Duration probeTimeout;
    private final ObjectMapper objectMapper;

    public FfprobeMediaProber(ReelExportProperties properties, ObjectMapper objectMapper) {
        this.ffprobeBinary = properties.getFfprobeBinary();
        this.probeTimeout = properties.getProbeTimeout();
        this.objectMapper = objectMapper;
    }

    @Override
    public MediaProbe probe(Path mediaPath) throws IOException, InterruptedException {
        List<String> command = buildCommand(mediaPath);
        logger.debug("Probing {}: {}", mediaPath, String.join(" ", command));

        Process process = new ProcessBuilder(command).start();
        // stderr stays out of the JSON; both pipes drain while waitFor bounds the run.
        CompletableFuture<String> stdout = readAsync(process.getInputStream(), "ffprobe-stdout");
        CompletableFuture<String> stderr = readAsync(process.getErrorStream(), "ffprobe-stderr");

        boolean finished;
        try {
            finished = process.waitFor(probeTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        }
        if (!finished) {
            process.destroyForcibly();
            throw new IOException("ffprobe timed out after " + probeTimeout + " for " + mediaPath.getFileName() + ".");
        }

        String output = awaitOutput(stdout);
        if (process.exitValue() != 0) {
            throw new IOException(
                    "Could not read media metadata for "
                            + mediaPath.getFileName()
                            + " (ffprobe exit code "
                            + process.exitValue()
                            + "): "
                            + awaitOutput(stderr).trim());
        }
        String warnings = awaitOutput(stderr).trim();
        if (!warnings.isEmpty()) {
            logger.debug("ffprobe reported for {}: {}", mediaPath.getFileName(), warnings);
        }
        return parseProbeOutput(output);
    }

    private CompletableFuture<String> readAsync(InputStream stream, String threadName) {
        CompletableFuture<String> result = new CompletableFuture<>();
        Thread reader = new Thread(() -> {
            try (InputStream in = stream) {
                result.complete(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            } catch (IOException e) {
                result.completeExceptionally(e);
            }
        }, threadName);
        reader.setDaemon(true);
        reader.start();
        return result;
    }

    private String awaitOutput(CompletableFuture<String> output) throws IOException, InterruptedException {
        try {
            return output.get(OUTPUT_DRAIN_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            throw new IOException("Could not read ffprobe output.", e.getCause());
        } catch (TimeoutException e) {
            throw new IOException("ffprobe output was not closed after the process exited.", e);
        }
    }

    List<String> buildCommand(Path mediaPath) {
        return List.of(
                ffprobeBinary,
                "-v", "error",
                "-print_format", "json",
                "-show_format",
                "-show_streams",
                mediaPath.toString());
    }

    MediaProbe parseProbeOutput(String json) throws IOException {
        JsonNode root = objectMapper.readTree(json);
        if (root == null || root.isMissingNode()) {
            throw new IOException("ffprobe returned no metadata.");
        }

        boolean hasVideo = false;
        boolean hasAudio = false;
        double streamDuration = 0.0;
        for (JsonNode stream : root.path("streams")) {
            String codecType = stream.path("codec_type").asText("");
            if ("video".equals(codecType)) {
                hasVideo = true;
            } else if ("audio".equals(codecType)) {
                hasAudio = true;
            }
            streamDuration = Math.max(streamDuration, parseDuration(stream.path("duration")));
        }

        double duration = parseDuration(root.path("format").path("duration"));
        if (duration <= 0.0) {
            duration = streamDuration;
        }
        if (!hasVideo && !hasAudio) {
            throw new IOException("Media file has neither a video nor an audio stream.");
        }
        return new MediaProbe(duration, hasVideo, hasAudio);
    }

    private double parseDuration(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return 0.0;
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        try {
            double value = Double.parseDouble(node.asText());
            return Double.isFinite(value) ? value : 0.0;
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }
}
