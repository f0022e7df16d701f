package com.auctionagent.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which component produced a {@link FinalDecision}.
 */
public enum DecisionSource {

    LLM("llm"),
    RULES_FALLBACK("rules_fallback"),
    SAFETY_BLOCK("safety_block"),
    SYSTEM_ERROR("system_error");

    private final String wire;

    DecisionSource(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static DecisionSource fromWire(String value) {
        for (DecisionSource s : values()) {
            if (s.wire.equalsIgnoreCase(value)) return s;
        }
        throw new IllegalArgumentException("Unknown decision source: " + value);
    }
}
