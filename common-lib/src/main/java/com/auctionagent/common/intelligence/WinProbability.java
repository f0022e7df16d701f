package com.auctionagent.common.intelligence;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param confidenceLevel {@code high} above 0.7, {@code medium} above 0.4, else {@code low}
 */
public record WinProbability(
    @JsonProperty("win_probability")       double probability,
    @JsonProperty("confidence_level")      String confidenceLevel,
    @JsonProperty("competition_level")     int    competitionLevel,
    @JsonProperty("opponent_strength")     double opponentStrength,
    @JsonProperty("budget_adequacy")       double budgetAdequacy,
    @JsonProperty("domain_predictability") double domainPredictability
) {}
