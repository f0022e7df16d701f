package com.auctionagent.common.intelligence;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PricePercentiles(
    @JsonProperty("p25") double p25,
    @JsonProperty("p50") double p50,
    @JsonProperty("p75") double p75,
    @JsonProperty("p90") double p90
) {}
