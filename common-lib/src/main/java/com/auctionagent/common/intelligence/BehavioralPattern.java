package com.auctionagent.common.intelligence;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Cluster-level intelligence used when the opponent has no exact profile.
 *
 * @param foldProbability {@code 1 - mean win rate} of the matched cluster
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BehavioralPattern(
    @JsonProperty("found")                    boolean         found,
    @JsonProperty("behavior_cluster")         BehaviorCluster cluster,
    @JsonProperty("sample_size")              int             sampleSize,
    @JsonProperty("avg_win_rate")             double          avgWinRate,
    @JsonProperty("fold_probability")         double          foldProbability,
    @JsonProperty("avg_late_bid_ratio")       double          avgLateBidRatio,
    @JsonProperty("is_aggressive_cluster")    boolean         aggressiveCluster,
    @JsonProperty("is_passive_cluster")       boolean         passiveCluster,
    @JsonProperty("strategic_recommendation") String          counterStrategy
) {
    public static BehavioralPattern notFound() {
        return new BehavioralPattern(false, null, 0, 0, 0, 0, false, false, null);
    }
}
