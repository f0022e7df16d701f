package com.auctionagent.common.history;

import com.auctionagent.common.model.Platform;
import com.auctionagent.common.model.Strategy;
import com.auctionagent.common.model.ValueTier;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aggregate results of a strategy, optionally narrowed to a platform and value tier
 * ({@code null} means all).
 */
public record StrategyPerformance(
    @JsonProperty("strategy")           Strategy  strategy,
    @JsonProperty("platform")           Platform  platform,
    @JsonProperty("value_tier")         ValueTier valueTier,
    @JsonProperty("total_uses")         long      totalUses,
    @JsonProperty("wins")               long      wins,
    @JsonProperty("total_profit")       double    totalProfit,
    @JsonProperty("win_rate")           double    winRate,
    @JsonProperty("avg_profit_per_win") double    avgProfitPerWin
) {
    public static StrategyPerformance of(Strategy strategy, Platform platform, ValueTier tier,
                                         long totalUses, long wins, double totalProfit) {
        double winRate = totalUses > 0 ? (double) wins / totalUses : 0.0;
        double avgProfit = wins > 0 ? totalProfit / wins : 0.0;
        return new StrategyPerformance(strategy, platform, tier, totalUses, wins, totalProfit,
                                       winRate, avgProfit);
    }

    public static StrategyPerformance empty(Strategy strategy, Platform platform, ValueTier tier) {
        return of(strategy, platform, tier, 0, 0, 0.0);
    }
}
