package com.auctionagent.orchestrator.model;

import com.auctionagent.common.model.AuctionContext;
import com.auctionagent.common.model.FinalDecision;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Body of {@code POST /api/v1/auction/round}. */
public record RoundRequest(
    @JsonProperty("context")      AuctionContext context,
    @JsonProperty("decision")     FinalDecision  decision,
    @JsonProperty("result_round") String         resultRound
) {
    public RoundRequest {
        if (context == null || decision == null) {
            throw new IllegalArgumentException("context and decision are required");
        }
    }
}
