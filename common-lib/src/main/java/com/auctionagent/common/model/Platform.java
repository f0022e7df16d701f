package com.auctionagent.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Supported auction platforms with their bid increment and extension rules.
 *
 * <ul>
 *   <li>GODADDY: flat $5 increment, 5-minute auto-extension on late bids</li>
 *   <li>NAMEJET: flat $5 increment, no extensions</li>
 *   <li>DYNADOT: 5% of the current bid with a $5 floor, extensions vary</li>
 * </ul>
 */
public enum Platform {

    GODADDY("godaddy", true, 5),
    NAMEJET("namejet", false, 0),
    DYNADOT("dynadot", false, 0);

    public static final double FLAT_INCREMENT = 5.0;
    public static final double VARIABLE_INCREMENT_RATE = 0.05;

    private final String wire;
    private final boolean lateExtension;
    private final int extensionMinutes;

    Platform(String wire, boolean lateExtension, int extensionMinutes) {
        this.wire = wire;
        this.lateExtension = lateExtension;
        this.extensionMinutes = extensionMinutes;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    /** True when a bid placed near the close pushes the end time out. */
    public boolean hasLateExtension() {
        return lateExtension;
    }

    public int extensionMinutes() {
        return extensionMinutes;
    }

    /**
     * Minimum increment over {@code currentBid} that the platform accepts.
     */
    public double bidIncrement(double currentBid) {
        return switch (this) {
            case GODADDY, NAMEJET -> FLAT_INCREMENT;
            case DYNADOT -> Math.max(FLAT_INCREMENT, currentBid * VARIABLE_INCREMENT_RATE);
        };
    }

    /** Prompt-facing description of the platform's bidding rules. */
    public String ruleSummary() {
        return switch (this) {
            case GODADDY -> "GoDaddy: 5-minute auto-extension on late bids, $5 minimum increment";
            case NAMEJET -> "NameJet: no extensions, $5 minimum increment";
            case DYNADOT -> "Dynadot: variable increments (5% of current bid, $5 floor), occasional extensions";
        };
    }

    @JsonCreator
    public static Platform fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("platform is required");
        }
        for (Platform p : values()) {
            if (p.wire.equalsIgnoreCase(value.trim())) return p;
        }
        throw new IllegalArgumentException("Unknown platform: " + value);
    }
}
