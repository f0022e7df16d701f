package com.auctionagent.common.intelligence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** One row of the offline auction-archetype table. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ArchetypeStat(
    @JsonProperty("auction_id")     String auctionId,
    @JsonProperty("late_bid_ratio") double lateBidRatio,
    @JsonProperty("avg_bid_jump")   double avgBidJump,
    @JsonProperty("duration_sec")   double durationSec
) {}
