package com.auctionagent.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse bucket derived from a domain's estimated value.
 * HIGH ≥ 1000, MEDIUM ≥ 100, LOW below.
 */
public enum ValueTier {

    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    public static final double HIGH_THRESHOLD = 1000.0;
    public static final double MEDIUM_THRESHOLD = 100.0;

    private final String wire;

    ValueTier(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    public static ValueTier of(double estimatedValue) {
        if (estimatedValue >= HIGH_THRESHOLD) return HIGH;
        if (estimatedValue >= MEDIUM_THRESHOLD) return MEDIUM;
        return LOW;
    }

    @JsonCreator
    public static ValueTier fromWire(String value) {
        for (ValueTier t : values()) {
            if (t.wire.equalsIgnoreCase(value)) return t;
        }
        throw new IllegalArgumentException("Unknown value tier: " + value);
    }
}
