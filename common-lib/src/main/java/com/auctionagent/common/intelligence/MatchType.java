package com.auctionagent.common.intelligence;

import com.fasterxml.jackson.annotation.JsonValue;

/** Which domain-intelligence tier produced the match. */
public enum MatchType {

    EXACT,
    TLD_PATTERN,
    VALUE_TIER,
    PLATFORM_AVERAGE,
    NONE;

    @JsonValue
    public String wire() {
        return name().toLowerCase();
    }
}
