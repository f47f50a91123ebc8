package github.sarthakdev143.reel_export.model.timeline;

import github.sarthakdev143.reel_export.model.TransitionType;

public record Transition(
        TransitionType type,
        double durationSec) {

    public boolean isActive() {
        return type != null && durationSec > 0.0;
    }
}
