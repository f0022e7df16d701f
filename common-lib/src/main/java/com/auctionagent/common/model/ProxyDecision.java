package com.auctionagent.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Concrete proxy-bid adjustment derived from an {@link AuctionContext} and the chosen strategy.
 *
 * @param newProxyMax   the proxy ceiling to set; {@code null} when the proxy is kept or abandoned
 * @param nextBidAmount the immediate bid to place; {@code null} when no bid should be placed
 */
public record ProxyDecision(
    @JsonProperty("current_proxy")          double      currentProxy,
    @JsonProperty("current_bid")            double      currentBid,
    @JsonProperty("safe_max")               double      safeMax,
    @JsonProperty("should_increase_proxy")  boolean     shouldIncreaseProxy,
    @JsonProperty("new_proxy_max")          Double      newProxyMax,
    @JsonProperty("next_bid_amount")        Double      nextBidAmount,
    @JsonProperty("max_budget_for_domain")  double      maxBudgetForDomain,
    @JsonProperty("proxy_action")           ProxyAction proxyAction,
    @JsonProperty("explanation")            String      explanation
) {}
