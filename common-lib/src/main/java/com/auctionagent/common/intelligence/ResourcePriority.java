package com.auctionagent.common.intelligence;

public enum ResourcePriority {

    HIGH("Allocate maximum safe budget"),
    MEDIUM("Allocate moderate budget"),
    LOW("Minimal bid or skip");

    private final String action;

    ResourcePriority(String action) {
        this.action = action;
    }

    public String action() {
        return action;
    }
}
