package com.auctionagent.common.history;

import com.auctionagent.common.model.AuctionContext;
import com.auctionagent.common.model.DecisionSource;
import com.auctionagent.common.model.FinalDecision;
import com.auctionagent.common.model.Platform;
import com.auctionagent.common.model.Strategy;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One decision round inside a multi-round auction thread, keyed by
 * {@code (threadId, roundNumber)}.
 *
 * @param resultRound what happened after the round, e.g. {@code outbid}, {@code leading}
 */
public record AuctionRoundRecord(
    @JsonProperty("thread_id")               String         threadId,
    @JsonProperty("round_number")            int            roundNumber,
    @JsonProperty("domain")                  String         domain,
    @JsonProperty("platform")                Platform       platform,
    @JsonProperty("estimated_value")         double         estimatedValue,
    @JsonProperty("current_bid_at_decision") double         currentBidAtDecision,
    @JsonProperty("strategy_used")           Strategy       strategyUsed,
    @JsonProperty("recommended_bid")         double         recommendedBid,
    @JsonProperty("decision_source")         DecisionSource decisionSource,
    @JsonProperty("confidence")              double         confidence,
    @JsonProperty("result_round")            String         resultRound,
    @JsonProperty("timestamp")               Instant        timestamp
) {
    public AuctionRoundRecord {
        if (threadId == null || threadId.isBlank()) {
            throw new IllegalArgumentException("thread_id is required");
        }
        if (roundNumber < 1) {
            throw new IllegalArgumentException("round_number must be >= 1, got " + roundNumber);
        }
    }

    public static AuctionRoundRecord of(AuctionContext ctx, FinalDecision decision,
                                        int roundNumber, String resultRound) {
        return new AuctionRoundRecord(ctx.threadId(), roundNumber, ctx.domain(), ctx.platform(),
            ctx.estimatedValue(), ctx.currentBid(), decision.strategy(), decision.recommendedBidAmount(),
            decision.decisionSource(), decision.confidence(), resultRound, Instant.now());
    }
}
