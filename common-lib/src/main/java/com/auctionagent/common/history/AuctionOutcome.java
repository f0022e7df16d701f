package com.auctionagent.common.history;

import com.auctionagent.common.model.AuctionContext;
import com.auctionagent.common.model.AuctionResult;
import com.auctionagent.common.model.DecisionSource;
import com.auctionagent.common.model.FinalDecision;
import com.auctionagent.common.model.Platform;
import com.auctionagent.common.model.Strategy;
import com.auctionagent.common.model.ValueTier;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Completed auction, keyed by {@code auctionId}. Re-recording the same id replaces the row.
 *
 * @param profitMargin {@code (estimatedValue - finalPrice) / estimatedValue}, set only when won
 */
public record AuctionOutcome(
    @JsonProperty("auction_id")                 String         auctionId,
    @JsonProperty("domain")                     String         domain,
    @JsonProperty("platform")                   Platform       platform,
    @JsonProperty("timestamp")                  Instant        timestamp,
    @JsonProperty("estimated_value")            double         estimatedValue,
    @JsonProperty("current_bid_at_decision")    double         currentBidAtDecision,
    @JsonProperty("final_price")                Double         finalPrice,
    @JsonProperty("num_bidders")                int            numBidders,
    @JsonProperty("hours_remaining_at_decision") double        hoursRemainingAtDecision,
    @JsonProperty("bot_detected")               boolean        botDetected,
    @JsonProperty("strategy_used")              Strategy       strategyUsed,
    @JsonProperty("recommended_bid")            double         recommendedBid,
    @JsonProperty("decision_source")            DecisionSource decisionSource,
    @JsonProperty("confidence")                 double         confidence,
    @JsonProperty("result")                     AuctionResult  result,
    @JsonProperty("profit_margin")              Double         profitMargin,
    @JsonProperty("opponent_hash")              String         opponentHash
) {
    public AuctionOutcome {
        if (auctionId == null || auctionId.isBlank()) {
            throw new IllegalArgumentException("auction_id is required");
        }
        if (result == null) {
            throw new IllegalArgumentException("result is required");
        }
    }

    public static AuctionOutcome of(String auctionId, AuctionContext ctx, FinalDecision decision,
                                    AuctionResult result, Double finalPrice, String opponentHash) {
        Double margin = null;
        if (result == AuctionResult.WON && finalPrice != null && ctx.estimatedValue() > 0) {
            margin = (ctx.estimatedValue() - finalPrice) / ctx.estimatedValue();
        }
        return new AuctionOutcome(auctionId, ctx.domain(), ctx.platform(), Instant.now(),
            ctx.estimatedValue(), ctx.currentBid(), finalPrice, ctx.numBidders(), ctx.hoursRemaining(),
            ctx.bidderAnalysis().botDetected(), decision.strategy(), decision.recommendedBidAmount(),
            decision.decisionSource(), decision.confidence(), result, margin, opponentHash);
    }

    @JsonIgnore
    public ValueTier valueTier() {
        return ValueTier.of(estimatedValue);
    }

    @JsonIgnore
    public boolean won() {
        return result == AuctionResult.WON;
    }

    /** Profit realised on a win: {@code margin × finalPrice}, else 0. */
    @JsonIgnore
    public double realisedProfit() {
        if (!won() || profitMargin == null || finalPrice == null) return 0.0;
        return profitMargin * finalPrice;
    }
}
