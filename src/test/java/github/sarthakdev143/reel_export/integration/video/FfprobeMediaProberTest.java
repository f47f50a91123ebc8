package github.sarthakdev143.reel_export.integration.video;

import com.fasterxml.jackson.databind.ObjectMapper;
import github.sarthakdev143.reel_export.config.ReelExportProperties;
import github.sarthakdev143.reel_export.model.timeline.MediaProbe;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FfprobeMediaProberTest {

    private final FfprobeMediaProber prober = new FfprobeMediaProber(new ReelExportProperties(), new ObjectMapper());

    @Test
    void buildCommandRequestsJsonFormatAndStreams() {
        assertThat(prober.buildCommand(Path.of("clip.mp4"))).containsExactly(
                "ffprobe", "-v", "error", "-print_format", "json", "-show_format", "-show_streams", "clip.mp4");
    }

    @Test
    void parsesStreamsAndFormatDuration() throws IOException {
        MediaProbe probe = prober.parseProbeOutput("""
                {
                  "streams": [
                    {"index": 0, "codec_type": "video", "width": 1920, "height": 1080, "duration": "12.000000"},
                    {"index": 1, "codec_type": "audio", "sample_rate": "48000", "duration": "11.980000"}
                  ],
                  "format": {"duration": "12.034000"}
                }
                """);

        assertThat(probe.hasVideo()).isTrue();
        assertThat(probe.hasAudio()).isTrue();
        assertThat(probe.durationSec()).isEqualTo(12.034);
    }

    @Test
    void fallsBackToLongestStreamDurationAndDetectsSilentVideo() throws IOException {
        MediaProbe probe = prober.parseProbeOutput("""
                {"streams": [{"codec_type": "video", "duration": 7.5}], "format": {"duration": "N/A"}}
                """);

        assertThat(probe.hasAudio()).isFalse();
        assertThat(probe.durationSec()).isEqualTo(7.5);
    }

    @Test
    void rejectsFilesWithoutMediaStreams() {
        assertThatThrownBy(() -> prober.parseProbeOutput("""
                {"streams": [{"codec_type": "data"}], "format": {"duration": "3.0"}}
                """))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("neither a video nor an audio stream");
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void hungFfprobeIsStoppedAtTheProbeTimeout(@TempDir Path workDir) throws IOException {
        FfprobeMediaProber hungProber = proberFor(script(workDir, "exec sleep 10"), Duration.ofMillis(300));

        long started = System.nanoTime();
        assertThatThrownBy(() -> hungProber.probe(workDir.resolve("clip.mp4")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("timed out");
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(5));
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void warningsOnStderrDoNotBreakTheJson(@TempDir Path workDir) throws Exception {
        FfprobeMediaProber noisyProber = proberFor(script(workDir,
                "echo '[mov,mp4,m4a,3gp,3g2,mj2 @ 0x1] stream 1, offset 0x30: partial file' >&2\n"
                        + "echo '{\"streams\": [{\"codec_type\": \"video\"}], \"format\": {\"duration\": \"4.0\"}}'"),
                Duration.ofSeconds(10));

        MediaProbe probe = noisyProber.probe(workDir.resolve("clip.mp4"));

        assertThat(probe.hasVideo()).isTrue();
        assertThat(probe.durationSec()).isEqualTo(4.0);
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void failedProbeReportsExitCodeAndStderr(@TempDir Path workDir) throws IOException {
        FfprobeMediaProber failingProber = proberFor(script(workDir,
                "echo 'clip.mp4: Invalid data found when processing input' >&2\nexit 1"),
                Duration.ofSeconds(10));

        assertThatThrownBy(() -> failingProber.probe(workDir.resolve("clip.mp4")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("exit code 1")
                .hasMessageContaining("Invalid data found");
    }

    private FfprobeMediaProber proberFor(Path binary, Duration timeout) {
        ReelExportProperties properties = new ReelExportProperties();
        properties.setFfprobeBinary(binary.toString());
        properties.setProbeTimeout(timeout);
        return new FfprobeMediaProber(properties, new ObjectMapper());
    }

    private Path script(Path dir, String body) throws IOException {
        Path script = dir.resolve("fake-ffprobe.sh");
        Files.writeString(script, "#!/bin/sh\n" + body + "\n", StandardCharsets.UTF_8);
        assertThat(script.toFile().setExecutable(true)).isTrue();
        return script;
    }
}
