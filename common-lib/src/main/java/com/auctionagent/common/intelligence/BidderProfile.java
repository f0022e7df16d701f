package com.auctionagent.common.intelligence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** One row of the offline bidder-profile table. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BidderProfile(
    @JsonProperty("bidder_id")         String bidderId,
    @JsonProperty("total_auctions")    int    totalAuctions,
    @JsonProperty("total_bids")        int    totalBids,
    @JsonProperty("avg_bid_increase")  double avgBidIncrease,
    @JsonProperty("max_bid")           double maxBid,
    @JsonProperty("win_rate")          double winRate,
    @JsonProperty("late_bid_ratio")    double lateBidRatio,
    @JsonProperty("avg_reaction_time") double avgReactionTime,
    @JsonProperty("proxy_usage")       double proxyUsage
) {}
