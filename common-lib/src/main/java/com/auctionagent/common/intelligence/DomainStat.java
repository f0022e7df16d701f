package com.auctionagent.common.intelligence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** One row of the offline per-domain price table. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DomainStat(
    @JsonProperty("domain")          String domain,
    @JsonProperty("avg_final_price") double avgFinalPrice,
    @JsonProperty("volatility")      double volatility,
    @JsonProperty("avg_bids")        double avgBids
) {
    /** Lower-case TLD including the dot, or {@code null} when the name has none. */
    public String tld() {
        return tldOf(domain);
    }

    public static String tldOf(String domain) {
        if (domain == null) return null;
        int dot = domain.lastIndexOf('.');
        if (dot < 0 || dot == domain.length() - 1) return null;
        return domain.substring(dot).toLowerCase();
    }
}
