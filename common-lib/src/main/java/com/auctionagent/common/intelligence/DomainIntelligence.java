package com.auctionagent.common.intelligence;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Best-available price prior for a domain. Fields that the matching tier does not
 * produce stay {@code null}; {@link #matchType} and {@link #confidence} always tell
 * consumers how far to trust the rest.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DomainIntelligence(
    @JsonProperty("found")               boolean          found,
    @JsonProperty("match_type")          MatchType        matchType,
    @JsonProperty("confidence")          double           confidence,
    @JsonProperty("average_final_price") Double           averageFinalPrice,
    @JsonProperty("price_volatility")    Double           priceVolatility,
    @JsonProperty("sample_size")         Integer          sampleSize,
    @JsonProperty("has_history")         boolean          hasHistory,
    @JsonProperty("is_volatile")         Boolean          isVolatile,
    @JsonProperty("tld")                 String           tld,
    @JsonProperty("is_premium_tld")      Boolean          premiumTld,
    @JsonProperty("is_budget_tld")       Boolean          budgetTld,
    @JsonProperty("price_percentiles")   PricePercentiles pricePercentiles,
    @JsonProperty("recommended_max_bid") Double           recommendedMaxBid,
    @JsonProperty("warning")             String           warning
) {
    public static final double VOLATILE_THRESHOLD = 0.3;

    public static DomainIntelligence notFound() {
        return new DomainIntelligence(false, MatchType.NONE, 0.0, null, null, null, false,
                                      null, null, null, null, null, null, null);
    }

    public boolean lowConfidence() {
        return found && confidence < 0.5;
    }

    /** Volatility to use in calculations; {@code fallback} when the tier did not produce one. */
    public double volatilityOr(double fallback) {
        return found && priceVolatility != null ? priceVolatility : fallback;
    }
}
