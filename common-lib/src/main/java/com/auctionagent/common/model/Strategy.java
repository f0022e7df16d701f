package com.auctionagent.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Strategy {

    PROXY_MAX("proxy_max"),
    LAST_MINUTE_SNIPE("last_minute_snipe"),
    INCREMENTAL_TEST("incremental_test"),
    WAIT_FOR_CLOSEOUT("wait_for_closeout"),
    AGGRESSIVE_EARLY("aggressive_early"),
    DO_NOT_BID("do_not_bid");

    private final String wire;

    Strategy(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static Strategy fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("strategy is required");
        }
        for (Strategy s : values()) {
            if (s.wire.equalsIgnoreCase(value.trim())) return s;
        }
        throw new IllegalArgumentException("Unknown strategy: " + value);
    }
}
