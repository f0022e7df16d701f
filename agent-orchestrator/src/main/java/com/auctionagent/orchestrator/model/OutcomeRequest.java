package com.auctionagent.orchestrator.model;

import com.auctionagent.common.model.AuctionContext;
import com.auctionagent.common.model.AuctionResult;
import com.auctionagent.common.model.FinalDecision;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /api/v1/auction/outcome}.
 *
 * @param auctionId optional; defaults to the thread id, then to {@code domain_epochMillis}
 */
public record OutcomeRequest(
    @JsonProperty("context")       AuctionContext context,
    @JsonProperty("decision")      FinalDecision  decision,
    @JsonProperty("result")        AuctionResult  result,
    @JsonProperty("final_price")   Double         finalPrice,
    @JsonProperty("auction_id")    String         auctionId,
    @JsonProperty("opponent_hash") String         opponentHash
) {
    public OutcomeRequest {
        if (context == null || decision == null || result == null) {
            throw new IllegalArgumentException("context, decision and result are required");
        }
    }
}
