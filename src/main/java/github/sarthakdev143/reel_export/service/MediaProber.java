package github.sarthakdev143.reel_export.service;

import github.sarthakdev143.reel_export.model.timeline.MediaProbe;

import java.io.IOException;
import java.nio.file.Path;

public interface MediaProber {

    MediaProbe probe(Path mediaPath) throws IOException, InterruptedException;
}
