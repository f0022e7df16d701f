package com.auctionagent.common.intelligence;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Aggregate behaviour of auctions on the platform. */
public record AuctionArchetype(
    @JsonProperty("found")              boolean found,
    @JsonProperty("escalation_speed")   String  escalationSpeed,
    @JsonProperty("sniper_dominated")   boolean sniperDominated,
    @JsonProperty("proxy_driven")       boolean proxyDriven,
    @JsonProperty("avg_late_bid_ratio") double  avgLateBidRatio,
    @JsonProperty("avg_bid_jump")       double  avgBidJump,
    @JsonProperty("avg_duration_sec")   double  avgDurationSec
) {
    public static AuctionArchetype notFound() {
        return new AuctionArchetype(false, null, false, false, 0, 0, 0);
    }
}
