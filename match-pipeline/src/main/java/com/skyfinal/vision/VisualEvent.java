package com.skyfinal.vision;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One classification result of the visual channel.
 */
public class VisualEvent {

    private final VisualLabel label;
    private final Instant timestamp;
    private final String detail;

    public VisualEvent(VisualLabel label, Instant timestamp, String detail) {
        this.label = label;
        this.timestamp = timestamp;
        this.detail = detail;
    }

    public static VisualEvent of(VisualLabel label, Instant timestamp) {
        return new VisualEvent(label, timestamp, null);
    }

    public static VisualEvent error(String message, Instant timestamp) {
        return new VisualEvent(VisualLabel.ERROR, timestamp, message);
    }

    public VisualLabel getLabel() {
        return label;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * Failure message for {@link VisualLabel#ERROR}, null otherwise.
     */
    public String getDetail() {
        return detail;
    }

    public boolean isError() {
        return label == VisualLabel.ERROR;
    }

    /**
     * Label as surfaced to operators, e.g. {@code "KILL"} or {@code "ERROR: timed out"}.
     */
    public String describe() {
        return isError() ? "ERROR: " + detail : label.name();
    }

    /**
     * Flag view consumed by the advisory layer.
     */
    public Map<String, Boolean> toFlags() {
        Map<String, Boolean> flags = new LinkedHashMap<>();
        flags.put("player_killed_enemy", label == VisualLabel.KILL);
        flags.put("player_died", label == VisualLabel.DEATH);
        flags.put("round_ended", label == VisualLabel.ROUND_END);
        flags.put("mid", label == VisualLabel.NO_EVENT);
        return flags;
    }

    @Override
    public String toString() {
        return "VisualEvent{" +
                "label=" + describe() +
                ", timestamp=" + timestamp +
                '}';
    }
}
