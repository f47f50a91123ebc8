package github.sarthakdev143.reel_export.model.timeline;

import java.util.List;

public record Clip(
        String clipId,
        String mediaId,
        double sourceStart,
        double sourceEnd,
        double timelineStart,
        Transition transitionStart,
        Transition transitionEnd,
        ColorGrading colorGrading,
        List<ReframeKeyframe> reframeKeyframes,
        double volume,
        boolean muted,
        String processedJobId) {

    public Clip {
        reframeKeyframes = reframeKeyframes == null ? List.of() : List.copyOf(reframeKeyframes);
    }

    public double durationSec() {
        return sourceEnd - sourceStart;
    }

    public double timelineEnd() {
        return timelineStart + durationSec();
    }
}
