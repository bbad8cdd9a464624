package com.skyfinal.state;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse health level derived from the current/max health ratio.
 */
public enum HealthBucket {
    FULL("full"),
    DAMAGED("damaged"),
    CRITICAL("critical"),
    UNKNOWN("unknown");

    private final String label;

    HealthBucket(String label) {
        this.label = label;
    }

    /**
     * Buckets a health reading. Ratio above 0.80 is full, above 0.30 damaged,
     * anything lower critical. A missing reading or a zero maximum is unknown.
     */
    public static HealthBucket of(Double current, Double maximum) {
        if (current == null || maximum == null || maximum == 0) {
            return UNKNOWN;
        }
        double ratio = current / maximum;
        if (ratio > 0.80) {
            return FULL;
        }
        if (ratio > 0.30) {
            return DAMAGED;
        }
        return CRITICAL;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
