package com.auctionagent.common.intelligence;

import com.fasterxml.jackson.annotation.JsonProperty;

/** {@code score = winProbability × expectedMargin × (1 + roi)}. */
public record ResourceScore(
    @JsonProperty("score")                 double           score,
    @JsonProperty("priority")              ResourcePriority priority,
    @JsonProperty("action_recommendation") String           actionRecommendation,
    @JsonProperty("explanation")           String           explanation
) {}
