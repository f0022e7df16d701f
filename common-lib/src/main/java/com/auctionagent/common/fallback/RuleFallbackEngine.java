package com.auctionagent.common.fallback;

import com.auctionagent.common.intelligence.MarketIntelligence;
import com.auctionagent.common.model.AuctionContext;
import com.auctionagent.common.model.RiskLevel;
import com.auctionagent.common.model.Strategy;
import com.auctionagent.common.model.StrategyDecision;
import com.auctionagent.common.model.ValueTier;

/**
 * Deterministic strategy selection used when the oracle is unavailable or rejected.
 *
 * <p>Safe max is 100% of the estimated value, discounted by
 * {@value #AGGRESSIVE_OPPONENT_DISCOUNT} when exact intelligence flags the last bidder
 * as aggressive. Dispatch is by {@link ValueTier}:
 *
 * <pre>
 * HIGH    no bidders and &lt;1h   → wait_for_closeout   0.85 low
 *         bot detected          → last_minute_snipe   0.80 medium
 *         ≤2 bidders            → proxy_max           0.75 medium
 *         otherwise             → last_minute_snipe   0.70 high
 * MEDIUM  extension rule, &lt;1h  → last_minute_snipe   0.80 medium
 *         &gt;5 bidders            → incremental_test    0.65 medium  (half of safe max)
 *         otherwise             → proxy_max           0.75 medium
 * LOW     no bidders            → wait_for_closeout   0.90 low
 *         otherwise             → incremental_test    0.70 low     (min(safe max, 50))
 * </pre>
 *
 * <p>This class is stateless, pure, and thread-safe.
 */
public final class RuleFallbackEngine {

    public static final double SAFE_MAX_RATIO = 1.00;
    public static final double AGGRESSIVE_OPPONENT_DISCOUNT = 0.95;
    public static final double LOW_TIER_BID_CAP = 50.0;

    private RuleFallbackEngine() {}

    /**
     * @param intel enrichment for the auction; {@code null} is treated as "nothing known"
     * @return a decision with {@code max_budget_for_domain = safe max}; never null
     */
    public static StrategyDecision decide(AuctionContext ctx, MarketIntelligence intel) {
        double safeMax = safeMax(ctx, intel);
        return switch (ctx.valueTier()) {
            case HIGH   -> highTier(ctx, safeMax);
            case MEDIUM -> mediumTier(ctx, safeMax);
            case LOW    -> lowTier(ctx, safeMax);
        };
    }

    public static double safeMax(AuctionContext ctx, MarketIntelligence intel) {
        double safeMax = ctx.estimatedValue() * SAFE_MAX_RATIO;
        if (intel != null && intel.aggressiveOpponent()) {
            safeMax *= AGGRESSIVE_OPPONENT_DISCOUNT;
        }
        return safeMax;
    }

    // ── tiers ───────────────────────────────────────────────────────────────

    private static StrategyDecision highTier(AuctionContext ctx, double safeMax) {
        if (ctx.numBidders() == 0 && ctx.hoursRemaining() < 1.0) {
            return decision(Strategy.WAIT_FOR_CLOSEOUT, safeMax, safeMax, 0.85, RiskLevel.LOW, String.format(
                "HIGH-VALUE CLOSEOUT: $%.2f domain with no bidders and under an hour left. "
                + "Holding back until closeout keeps competition away; bid capped at safe max $%.2f.",
                ctx.estimatedValue(), safeMax));
        }
        if (ctx.bidderAnalysis().botDetected()) {
            return decision(Strategy.LAST_MINUTE_SNIPE, safeMax, safeMax, 0.80, RiskLevel.MEDIUM, String.format(
                "HIGH-VALUE BOT COUNTER: bot detected (aggression %.1f/10) on %s. "
                + "A late snipe leaves the bot no reaction window; bid $%.2f stays within safe max.",
                ctx.bidderAnalysis().aggressionScore(), ctx.platform().wire(), safeMax));
        }
        if (ctx.numBidders() <= 2) {
            return decision(Strategy.PROXY_MAX, safeMax, safeMax, 0.75, RiskLevel.MEDIUM, String.format(
                "HIGH-VALUE PROXY: %d bidder(s) on a $%.2f domain. "
                + "Proxy max at $%.2f lets the platform auto-bid without exceeding the value budget.",
                ctx.numBidders(), ctx.estimatedValue(), safeMax));
        }
        return decision(Strategy.LAST_MINUTE_SNIPE, safeMax, safeMax, 0.70, RiskLevel.HIGH, String.format(
            "HIGH-VALUE COMPETITION: %d bidders raise escalation risk. "
            + "Sniping avoids an early bidding war; bid $%.2f protects the profit margin.",
            ctx.numBidders(), safeMax));
    }

    private static StrategyDecision mediumTier(AuctionContext ctx, double safeMax) {
        if (ctx.platform().hasLateExtension() && ctx.hoursRemaining() < 1.0) {
            return decision(Strategy.LAST_MINUTE_SNIPE, safeMax, safeMax, 0.80, RiskLevel.MEDIUM, String.format(
                "MEDIUM-VALUE EXTENSION TIMING: %s auction with under an hour left and a %d-minute extension rule. "
                + "Snipe timing avoids repeated extensions; bid $%.2f within safe max.",
                ctx.platform().wire(), ctx.platform().extensionMinutes(), safeMax));
        }
        if (ctx.numBidders() > 5) {
            double testBid = safeMax * 0.5;
            return decision(Strategy.INCREMENTAL_TEST, testBid, safeMax, 0.65, RiskLevel.MEDIUM, String.format(
                "MEDIUM-VALUE CROWD: %d bidders signal strong interest. "
                + "Incremental test at $%.2f gauges the competition before committing up to $%.2f.",
                ctx.numBidders(), testBid, safeMax));
        }
        return decision(Strategy.PROXY_MAX, safeMax, safeMax, 0.75, RiskLevel.MEDIUM, String.format(
            "MEDIUM-VALUE PROXY: %d bidder(s) on a $%.2f domain. "
            + "Proxy max at $%.2f handles incremental competition through platform auto-bidding.",
            ctx.numBidders(), ctx.estimatedValue(), safeMax));
    }

    private static StrategyDecision lowTier(AuctionContext ctx, double safeMax) {
        if (ctx.numBidders() == 0) {
            return decision(Strategy.WAIT_FOR_CLOSEOUT, safeMax, safeMax, 0.90, RiskLevel.LOW, String.format(
                "LOW-VALUE CLOSEOUT: no bidders on a $%.2f domain. "
                + "Waiting for closeout should secure it cheaply; bid capped at $%.2f.",
                ctx.estimatedValue(), safeMax));
        }
        double testBid = Math.min(safeMax, LOW_TIER_BID_CAP);
        return decision(Strategy.INCREMENTAL_TEST, testBid, safeMax, 0.70, RiskLevel.LOW, String.format(
            "LOW-VALUE INCREMENTAL: %d bidder(s) on a $%.2f domain. "
            + "Small incremental bid of $%.2f limits exposure on a low-value name.",
            ctx.numBidders(), ctx.estimatedValue(), testBid));
    }

    private static StrategyDecision decision(Strategy strategy, double bid, double safeMax,
                                             double confidence, RiskLevel risk, String reasoning) {
        return new StrategyDecision(strategy, bid, confidence, risk, reasoning, null, null, safeMax);
    }
}
