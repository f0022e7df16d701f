package com.auctionagent.common.intelligence;

import com.fasterxml.jackson.annotation.JsonValue;

/** Opponent archetype inferred from bidders with similar live behaviour. */
public enum BehaviorCluster {

    PROFESSIONAL("Avoid escalation. Set firm cap and be prepared to walk away."),
    CASUAL("Opponent likely to fold. Set moderate cap and bid confidently."),
    SNIPER("Counter-snipe in final seconds or use early proxy to discourage."),
    REGULAR("Standard competitive approach. Monitor and adjust dynamically.");

    private final String counterStrategy;

    BehaviorCluster(String counterStrategy) {
        this.counterStrategy = counterStrategy;
    }

    @JsonValue
    public String wire() {
        return name().toLowerCase();
    }

    /**
     * Counter-strategy for this cluster. A very high fold probability switches any
     * non-professional cluster to the casual advice.
     */
    public String counterStrategy(double foldProbability) {
        if (this != PROFESSIONAL && foldProbability > 0.85) {
            return CASUAL.counterStrategy;
        }
        return counterStrategy;
    }
}
