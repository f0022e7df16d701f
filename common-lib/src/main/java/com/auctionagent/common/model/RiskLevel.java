package com.auctionagent.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RiskLevel {

    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String wire;

    RiskLevel(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static RiskLevel fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("risk_level is required");
        }
        for (RiskLevel r : values()) {
            if (r.wire.equalsIgnoreCase(value.trim())) return r;
        }
        throw new IllegalArgumentException("Unknown risk level: " + value);
    }
}
