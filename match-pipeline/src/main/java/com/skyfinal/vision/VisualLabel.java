package com.skyfinal.vision;

import java.util.List;
import java.util.Locale;

/**
 * Labels the image classifier can answer with, plus the error sentinel.
 */
public enum VisualLabel {
    KILL(true),
    DEATH(true),
    ROUND_END(true),
    NO_EVENT(false),
    ERROR(false);

    /** Labels offered to the classifier, in matching order. */
    public static final List<VisualLabel> CLASSIFIABLE = List.of(KILL, DEATH, ROUND_END, NO_EVENT);

    private final boolean actionable;

    VisualLabel(boolean actionable) {
        this.actionable = actionable;
    }

    /**
     * Actionable labels are debounced; the others are liveness signals.
     */
    public boolean isActionable() {
        return actionable;
    }

    /**
     * Maps a raw model answer to a label by containment, checked in
     * {@link #CLASSIFIABLE} order. Anything unrecognised is {@link #NO_EVENT}.
     */
    public static VisualLabel parse(String raw) {
        if (raw == null) {
            return NO_EVENT;
        }
        String text = raw.trim().toUpperCase(Locale.ROOT);
        for (VisualLabel label : CLASSIFIABLE) {
            if (text.contains(label.name())) {
                return label;
            }
        }
        return NO_EVENT;
    }
}
