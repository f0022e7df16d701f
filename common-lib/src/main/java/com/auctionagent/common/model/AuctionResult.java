package com.auctionagent.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Terminal result of an auction from our side. */
public enum AuctionResult {

    WON("won"),
    LOST("lost"),
    ABANDONED("abandoned");

    private final String wire;

    AuctionResult(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static AuctionResult fromWire(String value) {
        for (AuctionResult r : values()) {
            if (r.wire.equalsIgnoreCase(value)) return r;
        }
        throw new IllegalArgumentException("Unknown auction result: " + value);
    }
}
