package com.auctionagent.common.history;

import com.auctionagent.common.model.Strategy;
import com.auctionagent.common.model.ValueTier;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * What history says about auctions like the current one.
 *
 * @param bestStrategy        historically best strategy for platform and tier; nullable
 * @param sameAuctionAttempts earlier rounds of the same thread, oldest first
 */
public record HistoricalContext(
    @JsonProperty("value_tier")                 ValueTier                          valueTier,
    @JsonProperty("similar_auctions_count")     int                                similarAuctionsCount,
    @JsonProperty("insights")                   HistoricalInsights                 insights,
    @JsonProperty("strategy_performance")       Map<Strategy, StrategyPerformance> strategyPerformance,
    @JsonProperty("historically_best_strategy") Strategy                           bestStrategy,
    @JsonProperty("same_auction_attempts")      List<AuctionRoundRecord>           sameAuctionAttempts
) {
    public HistoricalContext {
        strategyPerformance = strategyPerformance == null ? Map.of() : Map.copyOf(strategyPerformance);
        sameAuctionAttempts = sameAuctionAttempts == null ? List.of() : List.copyOf(sameAuctionAttempts);
        if (insights == null) insights = HistoricalInsights.none();
    }

    public static HistoricalContext empty(ValueTier tier) {
        return new HistoricalContext(tier, 0, HistoricalInsights.none(), Map.of(), null, List.of());
    }

    public boolean hasData() {
        return insights.hasData() || !sameAuctionAttempts.isEmpty() || bestStrategy != null;
    }
}
