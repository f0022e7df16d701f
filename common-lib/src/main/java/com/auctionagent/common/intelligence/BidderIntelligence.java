package com.auctionagent.common.intelligence;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Exact-match intelligence about the last opponent.
 *
 * <p>Derived flags: aggressive when the average bid increase exceeds
 * {@value #AGGRESSIVE_INCREASE}, sniper when the late-bid ratio exceeds
 * {@value #SNIPER_LATE_RATIO}, proxy-heavy when proxy usage exceeds {@value #PROXY_HEAVY_USAGE}.
 */
public record BidderIntelligence(
    @JsonProperty("found")                 boolean found,
    @JsonProperty("total_auctions")        int     totalAuctions,
    @JsonProperty("bids_per_auction")      double  bidsPerAuction,
    @JsonProperty("average_bid_increase")  double  averageBidIncrease,
    @JsonProperty("highest_ever_bid")      double  highestEverBid,
    @JsonProperty("win_rate")              double  winRate,
    @JsonProperty("late_bid_ratio")        double  lateBidRatio,
    @JsonProperty("average_reaction_time") double  averageReactionTime,
    @JsonProperty("proxy_usage_ratio")     double  proxyUsageRatio,
    @JsonProperty("is_aggressive")         boolean aggressive,
    @JsonProperty("is_sniper")             boolean sniper,
    @JsonProperty("is_proxy_heavy")        boolean proxyHeavy
) {
    public static final double AGGRESSIVE_INCREASE = 50.0;
    public static final double SNIPER_LATE_RATIO = 0.7;
    public static final double PROXY_HEAVY_USAGE = 0.8;

    public static BidderIntelligence notFound() {
        return new BidderIntelligence(false, 0, 0, 0, 0, 0, 0, 0, 0, false, false, false);
    }

    public static BidderIntelligence from(BidderProfile p) {
        return new BidderIntelligence(true,
            p.totalAuctions(),
            (double) p.totalBids() / Math.max(p.totalAuctions(), 1),
            p.avgBidIncrease(),
            p.maxBid(),
            p.winRate(),
            p.lateBidRatio(),
            p.avgReactionTime(),
            p.proxyUsage(),
            p.avgBidIncrease() > AGGRESSIVE_INCREASE,
            p.lateBidRatio() > SNIPER_LATE_RATIO,
            p.proxyUsage() > PROXY_HEAVY_USAGE);
    }
}
