package com.auctionagent.common.intelligence;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Everything the resolver knows about one auction, assembled by {@link MarketIntelligenceResolver#enrich}. */
public record MarketIntelligence(
    @JsonProperty("bidder_intelligence")         BidderIntelligence    bidder,
    @JsonProperty("behavioral_pattern")          BehavioralPattern     behavioralPattern,
    @JsonProperty("domain_intelligence")         DomainIntelligence    domain,
    @JsonProperty("auction_archetype")           AuctionArchetype      archetype,
    @JsonProperty("win_probability")             WinProbability        winProbability,
    @JsonProperty("expected_value_analysis")     ExpectedValueAnalysis expectedValue,
    @JsonProperty("resource_optimization_score") ResourceScore         resourceScore
) {
    /** True when exact opponent intelligence flags the last bidder as aggressive. */
    public boolean aggressiveOpponent() {
        return bidder != null && bidder.found() && bidder.aggressive();
    }
}
