package com.auctionagent.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable snapshot of one auction round, the single input of a pipeline run.
 *
 * <p>{@code estimatedValue <= 0} is accepted here so the safety gate can reject it
 * with a readable verdict. Every other numeric field must be non-negative.
 *
 * @param yourCurrentProxy our standing proxy maximum, {@code 0} when none is set
 * @param threadId         groups the rounds of one auction; nullable
 * @param lastBidderId     identifier of the opponent who placed the last bid; nullable
 */
public record AuctionContext(
    @JsonProperty("domain")             String   domain,
    @JsonProperty("platform")           Platform platform,
    @JsonProperty("estimated_value")    double   estimatedValue,
    @JsonProperty("current_bid")        double   currentBid,
    @JsonProperty("num_bidders")        int      numBidders,
    @JsonProperty("hours_remaining")    double   hoursRemaining,
    @JsonProperty("your_current_proxy") double   yourCurrentProxy,
    @JsonProperty("budget_available")   double   budgetAvailable,
    @JsonProperty("bidder_analysis")    BidderAnalysis bidderAnalysis,
    @JsonProperty("thread_id")          String   threadId,
    @JsonProperty("last_bidder_id")     String   lastBidderId
) {
    @JsonCreator
    public AuctionContext {
        if (domain == null || domain.isBlank()) {
            throw new IllegalArgumentException("domain is required");
        }
        if (platform == null) {
            throw new IllegalArgumentException("platform is required");
        }
        requireNonNegative("current_bid", currentBid);
        requireNonNegative("num_bidders", numBidders);
        requireNonNegative("hours_remaining", hoursRemaining);
        requireNonNegative("your_current_proxy", yourCurrentProxy);
        requireNonNegative("budget_available", budgetAvailable);
        if (bidderAnalysis == null) {
            bidderAnalysis = BidderAnalysis.neutral();
        }
    }

    /** Convenience constructor for a context without thread or opponent identity. */
    public AuctionContext(String domain, Platform platform, double estimatedValue, double currentBid,
                          int numBidders, double hoursRemaining, double yourCurrentProxy,
                          double budgetAvailable, BidderAnalysis bidderAnalysis) {
        this(domain, platform, estimatedValue, currentBid, numBidders, hoursRemaining,
             yourCurrentProxy, budgetAvailable, bidderAnalysis, null, null);
    }

    @JsonIgnore
    public ValueTier valueTier() {
        return ValueTier.of(estimatedValue);
    }

    @JsonIgnore
    public boolean hasProxy() {
        return yourCurrentProxy > 0;
    }

    private static void requireNonNegative(String field, double value) {
        if (value < 0 || Double.isNaN(value)) {
            throw new IllegalArgumentException(field + " must be >= 0, got " + value);
        }
    }
}
