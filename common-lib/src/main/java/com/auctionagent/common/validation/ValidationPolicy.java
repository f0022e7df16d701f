package com.auctionagent.common.validation;

/**
 * Tunable thresholds for {@link StrategyValidator}.
 *
 * @param bidCeilingRatio           hard ceiling as a fraction of estimated value
 * @param minReasoningLength        below this the proposal is rejected
 * @param recommendedReasoningLength below this (and above the minimum) a warning is raised
 * @param aggressiveEarlyMinValue   estimated value under which {@code aggressive_early} is rejected
 * @param misalignmentMargin        confidence/risk deviation beyond which a warning becomes an error
 * @param snipeLongHours            hours remaining above which a snipe is flagged
 * @param closeoutMaxBidders        bidder count above which waiting for closeout is flagged
 */
public record ValidationPolicy(
    double bidCeilingRatio,
    int    minReasoningLength,
    int    recommendedReasoningLength,
    double aggressiveEarlyMinValue,
    double misalignmentMargin,
    double snipeLongHours,
    int    closeoutMaxBidders
) {
    public ValidationPolicy {
        if (bidCeilingRatio <= 0) {
            throw new IllegalArgumentException("bidCeilingRatio must be > 0, got " + bidCeilingRatio);
        }
        if (recommendedReasoningLength < minReasoningLength) {
            throw new IllegalArgumentException("recommendedReasoningLength must be >= minReasoningLength");
        }
    }

    public static ValidationPolicy defaults() {
        return new ValidationPolicy(1.00, 50, 100, 200.0, 0.30, 2.0, 3);
    }

    public double ceilingFor(double estimatedValue) {
        return estimatedValue * bidCeilingRatio;
    }
}
