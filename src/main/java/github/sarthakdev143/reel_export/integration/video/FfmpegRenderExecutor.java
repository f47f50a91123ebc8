package github.sarthakdev143.reel_export.integration.video;

import github.sarthakdev143.reel_export.compiler.CompiledGraph;
import github.sarthakdev143.reel_export.compiler.GraphInput;
import github.sarthakdev143.reel_export.config.ReelExportProperties;
import github.sarthakdev143.reel_export.model.ContainerFormat;
import github.sarthakdev143.reel_export.model.OutputProfile;
import github.sarthakdev143.reel_export.service.ProgressListener;
import github.sarthakdev143.reel_export.service.RenderExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

@Component
public class FfmpegRenderExecutor implements RenderExecutor {

    private static final Logger logger = LoggerFactory.getLogger(FfmpegRenderExecutor.class);
    private static final int OUTPUT_TAIL_LINES = 20;

    private final String ffmpegBinary;
    private final Duration renderTimeout;
    private final Map<String, Process> runningProcesses = new ConcurrentHashMap<>();
    private final Set<String> cancelledJobs = ConcurrentHashMap.newKeySet();

    public FfmpegRenderExecutor(ReelExportProperties properties) {
        this.ffmpegBinary = properties.getFfmpegBinary();
        this.renderTimeout = properties.getRenderTimeout();
    }

    @Override
    public void render(
            String jobId,
            CompiledGraph graph,
            OutputProfile profile,
            Path outputPath,
            ProgressListener listener) throws IOException, InterruptedException {
        List<String> command = buildCommand(graph, profile, outputPath);
        logger.info("Running FFmpeg for job {} profile {}: {}", jobId, profile, String.join(" ", command));

        FfmpegProgressParser parser = new FfmpegProgressParser(graph.durationSec());
        Process process = new ProcessBuilder(command)
                .redirectErrorStream(true)
                .start();
        runningProcesses.put(jobId, process);

        Deque<String> outputTail = new ArrayDeque<>();
        Thread reader = new Thread(
                () -> drainOutput(jobId, process, parser, listener, outputTail),
                "ffmpeg-output-" + jobId);
        reader.setDaemon(true);
        reader.start();

        try {
            boolean finished = process.waitFor(renderTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                throw new IOException("FFmpeg timed out after " + renderTimeout + " for job " + jobId + ".");
            }
            reader.join(TimeUnit.SECONDS.toMillis(5));

            if (cancelledJobs.remove(jobId)) {
                throw new IOException("FFmpeg was cancelled for job " + jobId + ".");
            }
            if (process.exitValue() != 0) {
                throw new IOException(
                        "FFmpeg failed for job "
                                + jobId
                                + " with exit code "
                                + process.exitValue()
                                + ". Output: "
                                + tailOf(outputTail));
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        } finally {
            runningProcesses.remove(jobId);
            cancelledJobs.remove(jobId);
        }
    }

    @Override
    public boolean cancel(String jobId) {
        Process process = runningProcesses.get(jobId);
        if (process == null) {
            return false;
        }
        cancelledJobs.add(jobId);
        process.destroyForcibly();
        logger.info("Cancelled FFmpeg for job {}", jobId);
        return true;
    }

    @Override
    public int cancelAll() {
        int cancelled = 0;
        for (String jobId : List.copyOf(runningProcesses.keySet())) {
            if (cancel(jobId)) {
                cancelled++;
            }
        }
        return cancelled;
    }

    List<String> buildCommand(CompiledGraph graph, OutputProfile profile, Path outputPath) {
        List<String> command = new ArrayList<>();
        command.add(ffmpegBinary);
        command.add("-y");
        for (GraphInput input : graph.inputs()) {
            command.addAll(input.options());
            command.add("-i");
            command.add(input.path().toString());
        }
        command.add("-filter_complex");
        command.add(graph.filterComplex());
        command.add("-map");
        command.add(graph.videoOutput().toString());
        if (graph.audioOutput() != null) {
            command.add("-map");
            command.add(graph.audioOutput().toString());
        }
        command.addAll(profile.encoderArguments());
        if (profile.deliverable() && ContainerFormat.fromPath(outputPath).supportsFastStart()) {
            command.add("-movflags");
            command.add("+faststart");
        }
        command.add("-progress");
        command.add("pipe:1");
        command.add("-nostats");
        command.add(outputPath.toString());
        return command;
    }

    private void drainOutput(
            String jobId,
            Process process,
            FfmpegProgressParser parser,
            ProgressListener listener,
            Deque<String> outputTail) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (FfmpegProgressParser.isProgressLine(line)) {
                    parser.percent(line).ifPresent(listener::onProgress);
                    continue;
                }
                logger.debug("[ffmpeg {}] {}", jobId, line);
                synchronized (outputTail) {
                    outputTail.addLast(line);
                    if (outputTail.size() > OUTPUT_TAIL_LINES) {
                        outputTail.removeFirst();
                    }
                }
            }
        } catch (IOException e) {
            // The stream closes abruptly when the process is destroyed.
            if (process.isAlive()) {
                logger.warn("Lost FFmpeg output for job {}", jobId, e);
            } else {
                logger.debug("FFmpeg output closed for job {}: {}", jobId, e.getMessage());
            }
        }
    }

    private String tailOf(Deque<String> outputTail) {
        synchronized (outputTail) {
            return String.join(System.lineSeparator(), outputTail);
        }
    }
}
