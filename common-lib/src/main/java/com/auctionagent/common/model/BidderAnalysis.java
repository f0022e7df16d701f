package com.auctionagent.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Live read of the competing bidders in the current auction.
 *
 * @param botDetected      true when bid timing suggests automated bidding
 * @param corporateBuyer   true when an end-user company appears to be bidding
 * @param aggressionScore  0 (passive) to 10 (escalates on every bid)
 * @param reactionTimeAvg  mean seconds between being outbid and re-bidding
 */
public record BidderAnalysis(
    @JsonProperty("bot_detected")      boolean botDetected,
    @JsonProperty("corporate_buyer")   boolean corporateBuyer,
    @JsonProperty("aggression_score")  double  aggressionScore,
    @JsonProperty("reaction_time_avg") double  reactionTimeAvg
) {
    public static final double MAX_AGGRESSION = 10.0;

    public BidderAnalysis {
        if (aggressionScore < 0 || aggressionScore > MAX_AGGRESSION) {
            throw new IllegalArgumentException(
                "aggression_score must be within [0, 10], got " + aggressionScore);
        }
        if (reactionTimeAvg < 0) {
            throw new IllegalArgumentException("reaction_time_avg must be >= 0, got " + reactionTimeAvg);
        }
    }

    /** Neutral reading used when no live analysis was supplied. */
    public static BidderAnalysis neutral() {
        return new BidderAnalysis(false, false, 5.0, 60.0);
    }
}
