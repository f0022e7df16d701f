package com.auctionagent.common.validation;

import com.auctionagent.common.model.AuctionContext;
import com.auctionagent.common.model.RiskLevel;
import com.auctionagent.common.model.Strategy;
import com.auctionagent.common.model.StrategyDecision;
import com.auctionagent.common.model.ValidationResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Tiered acceptance of an oracle proposal.
 *
 * <h3>Hard checks (first failure rejects, later checks are skipped)</h3>
 * <ol>
 *   <li>bid ceiling: {@code bid > ceilingRatio × estimatedValue}</li>
 *   <li>budget: {@code bid > budgetAvailable}</li>
 *   <li>consistency: {@code do_not_bid} with a nonzero bid</li>
 *   <li>reasoning shorter than the minimum</li>
 *   <li>{@code aggressive_early} below the value floor</li>
 *   <li>confidence/risk deviation beyond the escalation margin</li>
 * </ol>
 *
 * <h3>Soft checks (warnings only)</h3>
 * Confidence/risk misalignment within the margin, short or shallow reasoning,
 * {@code wait_for_closeout} against a crowd, {@code last_minute_snipe} far from the close.
 *
 * <p>This class is stateless, pure, and thread-safe.
 */
public final class StrategyValidator {

    /** Confidence band per risk level: low ≥ 0.50, medium ≥ 0.35, high ≤ 0.80. */
    static final double LOW_RISK_MIN_CONFIDENCE = 0.50;
    static final double MEDIUM_RISK_MIN_CONFIDENCE = 0.35;
    static final double HIGH_RISK_MAX_CONFIDENCE = 0.80;

    static final List<List<String>> CONCEPT_GROUPS = List.of(
        List.of("profit", "margin", "value", "budget", "price", "roi"),
        List.of("risk", "overpay", "safe", "exposure"),
        List.of("competition", "bidder", "opponent", "bot", "competitor"),
        List.of("strategy", "snipe", "proxy", "timing", "increment", "closeout"));

    static final int MIN_CONCEPT_GROUPS = 2;

    private StrategyValidator() {}

    public static ValidationResult validate(StrategyDecision d, AuctionContext ctx, ValidationPolicy policy) {
        double ceiling = policy.ceilingFor(ctx.estimatedValue());
        if (d.recommendedBidAmount() > ceiling) {
            return ValidationResult.rejected(String.format(
                "BID CEILING VIOLATION: Recommended bid ($%.2f) exceeds %.0f%% of estimated value ($%.2f)",
                d.recommendedBidAmount(), policy.bidCeilingRatio() * 100, ceiling));
        }
        if (d.recommendedBidAmount() > ctx.budgetAvailable()) {
            return ValidationResult.rejected(String.format(
                "BUDGET VIOLATION: Recommended bid ($%.2f) exceeds available budget ($%.2f)",
                d.recommendedBidAmount(), ctx.budgetAvailable()));
        }
        if (d.strategy() == Strategy.DO_NOT_BID && d.recommendedBidAmount() > 0) {
            return ValidationResult.rejected(
                "LOGICAL INCONSISTENCY: Strategy is 'do_not_bid' but recommended_bid_amount > 0");
        }
        int length = d.reasoning().trim().length();
        if (length < policy.minReasoningLength()) {
            return ValidationResult.rejected(String.format(
                "REASONING INSUFFICIENT: Explanation too brief (%d chars), minimum %d",
                length, policy.minReasoningLength()));
        }
        if (d.strategy() == Strategy.AGGRESSIVE_EARLY && ctx.estimatedValue() < policy.aggressiveEarlyMinValue()) {
            return ValidationResult.rejected(String.format(
                "STRATEGY CONTEXT MISMATCH: 'aggressive_early' on a $%.2f domain, floor is $%.2f",
                ctx.estimatedValue(), policy.aggressiveEarlyMinValue()));
        }

        double deviation = misalignment(d.riskLevel(), d.confidence());
        if (deviation > policy.misalignmentMargin()) {
            return ValidationResult.rejected(String.format(
                "CONFIDENCE MISMATCH: confidence %.2f is %.2f outside the '%s' risk band",
                d.confidence(), deviation, d.riskLevel().wire()));
        }

        List<String> warnings = new ArrayList<>();
        if (deviation > 0) {
            warnings.add(String.format("confidence %.2f sits %.2f outside the '%s' risk band",
                d.confidence(), deviation, d.riskLevel().wire()));
        }
        if (length < policy.recommendedReasoningLength()) {
            warnings.add(String.format("reasoning is brief (%d chars, %d recommended)",
                length, policy.recommendedReasoningLength()));
        }
        int concepts = conceptGroupsCovered(d.reasoning());
        if (concepts < MIN_CONCEPT_GROUPS) {
            warnings.add(String.format(
                "reasoning covers %d of %d concept groups (financial, risk, competition, strategy)",
                concepts, CONCEPT_GROUPS.size()));
        }
        if (d.strategy() == Strategy.WAIT_FOR_CLOSEOUT && ctx.numBidders() > policy.closeoutMaxBidders()) {
            warnings.add(String.format("'wait_for_closeout' with %d active bidders", ctx.numBidders()));
        }
        if (d.strategy() == Strategy.LAST_MINUTE_SNIPE && ctx.hoursRemaining() > policy.snipeLongHours()) {
            warnings.add(String.format("'last_minute_snipe' with %.1f hours remaining", ctx.hoursRemaining()));
        }
        return new ValidationResult(List.of(), warnings);
    }

    /** Distance of {@code confidence} outside the band for {@code risk}; 0 when inside. */
    static double misalignment(RiskLevel risk, double confidence) {
        return switch (risk) {
            case LOW    -> Math.max(0.0, LOW_RISK_MIN_CONFIDENCE - confidence);
            case MEDIUM -> Math.max(0.0, MEDIUM_RISK_MIN_CONFIDENCE - confidence);
            case HIGH   -> Math.max(0.0, confidence - HIGH_RISK_MAX_CONFIDENCE);
        };
    }

    static int conceptGroupsCovered(String reasoning) {
        String lower = reasoning.toLowerCase(Locale.ROOT);
        int covered = 0;
        for (List<String> group : CONCEPT_GROUPS) {
            if (group.stream().anyMatch(lower::contains)) covered++;
        }
        return covered;
    }
}
