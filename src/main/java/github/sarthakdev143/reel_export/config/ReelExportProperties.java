package github.sarthakdev143.reel_export.config;

import github.sarthakdev143.reel_export.model.ExportStrategy;
import github.sarthakdev143.reel_export.model.MixDuration;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;

@ConfigurationProperties(prefix = "reel-export")
public class ReelExportProperties {
    private String uploadsDir = "./data/uploads";
    private String outputsDir = "./data/outputs";
    private String exportsDir = "./data/exports";
    private String ffmpegBinary = "ffmpeg";
    private String ffprobeBinary = "ffprobe";
    private Duration progressInterval = Duration.ofMillis(500);
    private Duration renderTimeout = Duration.ofHours(2);
    private Duration probeTimeout = Duration.ofSeconds(30);
    private int workerThreads = 2;
    private int queueCapacity = 50;
    private ExportStrategy exportStrategy = ExportStrategy.SINGLE_PASS;
    private MixDuration audioMixDuration = MixDuration.SHORTEST;
    private final Preflight preflight = new Preflight();

    public String getUploadsDir() { return uploadsDir; }
    public void setUploadsDir(String uploadsDir) { this.uploadsDir = uploadsDir; }

    public String getOutputsDir() { return outputsDir; }
    public void setOutputsDir(String outputsDir) { this.outputsDir = outputsDir; }

    public String getExportsDir() { return exportsDir; }
    public void setExportsDir(String exportsDir) { this.exportsDir = exportsDir; }

    public String getFfmpegBinary() { return ffmpegBinary; }
    public void setFfmpegBinary(String ffmpegBinary) { this.ffmpegBinary = ffmpegBinary; }

    public String getFfprobeBinary() { return ffprobeBinary; }
    public void setFfprobeBinary(String ffprobeBinary) { this.ffprobeBinary = ffprobeBinary; }

    public Duration getProgressInterval() { return progressInterval; }
    public void setProgressInterval(Duration progressInterval) { this.progressInterval = progressInterval; }

    public Duration getRenderTimeout() { return renderTimeout; }
    public void setRenderTimeout(Duration renderTimeout) { this.renderTimeout = renderTimeout; }

    public Duration getProbeTimeout() { return probeTimeout; }
    public void setProbeTimeout(Duration probeTimeout) { this.probeTimeout = probeTimeout; }

    public int getWorkerThreads() { return workerThreads; }
    public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }

    public int getQueueCapacity() { return queueCapacity; }
    public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }

    public ExportStrategy getExportStrategy() { return exportStrategy; }
    public void setExportStrategy(ExportStrategy exportStrategy) { this.exportStrategy = exportStrategy; }

    public MixDuration getAudioMixDuration() { return audioMixDuration; }
    public void setAudioMixDuration(MixDuration audioMixDuration) { this.audioMixDuration = audioMixDuration; }

    public Preflight getPreflight() { return preflight; }

    public Path uploadsPath() { return Path.of(uploadsDir); }

    public Path outputsPath() { return Path.of(outputsDir); }

    public Path exportsPath() { return Path.of(exportsDir); }

    public static class Preflight {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }
}
