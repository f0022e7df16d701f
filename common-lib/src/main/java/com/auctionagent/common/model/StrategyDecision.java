package com.auctionagent.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A proposed bidding action, from the oracle or from the rule engine.
 *
 * <p>{@code shouldIncreaseProxy} and {@code nextBidAmount} stay {@code null} until the
 * proxy engine has analysed the decision.
 */
public record StrategyDecision(
    @JsonProperty("strategy")               Strategy  strategy,
    @JsonProperty("recommended_bid_amount") double    recommendedBidAmount,
    @JsonProperty("confidence")             double    confidence,
    @JsonProperty("risk_level")             RiskLevel riskLevel,
    @JsonProperty("reasoning")              String    reasoning,
    @JsonProperty("should_increase_proxy")  Boolean   shouldIncreaseProxy,
    @JsonProperty("next_bid_amount")        Double    nextBidAmount,
    @JsonProperty("max_budget_for_domain")  double    maxBudgetForDomain
) {
    public StrategyDecision {
        if (strategy == null) {
            throw new IllegalArgumentException("strategy is required");
        }
        if (riskLevel == null) {
            throw new IllegalArgumentException("risk_level is required");
        }
        if (recommendedBidAmount < 0 || Double.isNaN(recommendedBidAmount)) {
            throw new IllegalArgumentException(
                "recommended_bid_amount must be >= 0, got " + recommendedBidAmount);
        }
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("confidence must be within [0, 1], got " + confidence);
        }
        if (maxBudgetForDomain < 0) {
            throw new IllegalArgumentException(
                "max_budget_for_domain must be >= 0, got " + maxBudgetForDomain);
        }
        if (reasoning == null) {
            reasoning = "";
        }
    }

    /** Decision before proxy analysis: proxy fields unset, budget cap equal to the bid. */
    public static StrategyDecision of(Strategy strategy, double recommendedBid, double confidence,
                                      RiskLevel riskLevel, String reasoning) {
        return new StrategyDecision(strategy, recommendedBid, confidence, riskLevel, reasoning,
                                    null, null, recommendedBid);
    }

    /** Copies the proxy engine's sizing fields onto this decision. */
    public StrategyDecision withProxyFields(ProxyDecision proxy) {
        return new StrategyDecision(strategy, recommendedBidAmount, confidence, riskLevel, reasoning,
                                    proxy.shouldIncreaseProxy(), proxy.nextBidAmount(),
                                    proxy.maxBudgetForDomain());
    }

    /**
     * Forces the decision to {@code do_not_bid}: bid zeroed, confidence capped at 0.5,
     * risk high and the override explanation appended to the reasoning.
     */
    public StrategyDecision overriddenToDoNotBid(String explanation) {
        String merged = reasoning.isBlank()
            ? "PROXY ANALYSIS OVERRIDE: " + explanation
            : reasoning + " PROXY ANALYSIS OVERRIDE: " + explanation;
        return new StrategyDecision(Strategy.DO_NOT_BID, 0.0, Math.min(confidence, 0.5),
                                    RiskLevel.HIGH, merged, false, null, 0.0);
    }
}
