package com.skyfinal.state;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse armor level.
 */
public enum ArmorBucket {
    NONE("none"),
    LIGHT("light"),
    HEAVY("heavy"),
    UNKNOWN("unknown");

    private final String label;

    ArmorBucket(String label) {
        this.label = label;
    }

    public static ArmorBucket of(Double armor) {
        if (armor == null) {
            return UNKNOWN;
        }
        if (armor <= 0) {
            return NONE;
        }
        if (armor <= 25) {
            return LIGHT;
        }
        return HEAVY;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
