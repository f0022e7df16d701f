package com.auctionagent.common.history;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Summary of similar past auctions.
 *
 * @param avgFinalPriceRatio mean of {@code finalPrice / estimatedValue}; {@code null} without prices
 * @param winningStrategies  wins per strategy wire name
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HistoricalInsights(
    @JsonProperty("has_data")              boolean           hasData,
    @JsonProperty("total_similar")         int               totalSimilar,
    @JsonProperty("win_rate")              double            winRate,
    @JsonProperty("avg_final_price_ratio") Double            avgFinalPriceRatio,
    @JsonProperty("price_ratio_insight")   String            priceRatioInsight,
    @JsonProperty("winning_strategies")    Map<String, Long> winningStrategies
) {
    public static HistoricalInsights none() {
        return new HistoricalInsights(false, 0, 0.0, null, null, Map.of());
    }
}
