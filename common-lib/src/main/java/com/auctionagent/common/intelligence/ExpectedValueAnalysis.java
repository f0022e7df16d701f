package com.auctionagent.common.intelligence;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ExpectedValueAnalysis(
    @JsonProperty("expected_final_price") double expectedFinalPrice,
    @JsonProperty("expected_profit")      double expectedProfit,
    @JsonProperty("expected_margin")      double expectedMargin,
    @JsonProperty("expected_value")       double expectedValue,
    @JsonProperty("risk_adjusted_ev")     double riskAdjustedEv,
    @JsonProperty("roi")                  double roi,
    @JsonProperty("recommendation")       BidRecommendation recommendation
) {}
