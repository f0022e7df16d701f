package com.auctionagent.common.safety;

import com.auctionagent.common.model.AuctionContext;

import java.util.Optional;

/**
 * Non-overridable pre-checks that reject auctions before any strategy is considered.
 *
 * <p>Rules run in a fixed priority order and the first match wins:
 * <ol>
 *   <li>Valuation validity: {@code estimatedValue <= 0}</li>
 *   <li>Minimum budget: {@code budgetAvailable < }{@value #MIN_BUDGET}</li>
 *   <li>Overpayment protection: {@code currentBid > }{@value #OVERPAYMENT_RATIO}{@code × estimatedValue}</li>
 *   <li>Portfolio concentration: {@code estimatedValue > }{@value #CONCENTRATION_RATIO}{@code × budgetAvailable}</li>
 * </ol>
 *
 * <p>This class is stateless, pure, and thread-safe.
 */
public final class SafetyGate {

    public static final double MIN_BUDGET = 100.0;
    public static final double OVERPAYMENT_RATIO = 1.30;
    public static final double CONCENTRATION_RATIO = 0.50;

    private SafetyGate() {}

    /**
     * @return {@link Verdict#pass()} or the first blocking verdict; never null
     */
    public static Verdict evaluate(AuctionContext ctx) {
        return checkValuation(ctx)
            .or(() -> checkMinimumBudget(ctx))
            .or(() -> checkOverpayment(ctx))
            .or(() -> checkConcentration(ctx))
            .orElseGet(Verdict::pass);
    }

    private static Optional<Verdict> checkValuation(AuctionContext ctx) {
        if (ctx.estimatedValue() > 0) return Optional.empty();
        return Optional.of(Verdict.block(SafetyRule.VALUATION_INVALID, String.format(
            "VALUATION INVALID: Estimated value ($%.2f) is invalid or missing. "
            + "Cannot calculate profit margins. Strategy: do_not_bid",
            ctx.estimatedValue())));
    }

    private static Optional<Verdict> checkMinimumBudget(AuctionContext ctx) {
        if (ctx.budgetAvailable() >= MIN_BUDGET) return Optional.empty();
        return Optional.of(Verdict.block(SafetyRule.MINIMUM_BUDGET, String.format(
            "MINIMUM BUDGET: Insufficient budget ($%.2f) for meaningful auction participation. "
            + "Minimum required: $%.0f. Strategy: do_not_bid",
            ctx.budgetAvailable(), MIN_BUDGET)));
    }

    private static Optional<Verdict> checkOverpayment(AuctionContext ctx) {
        if (ctx.currentBid() <= ctx.estimatedValue() * OVERPAYMENT_RATIO) return Optional.empty();
        return Optional.of(Verdict.block(SafetyRule.OVERPAYMENT_PROTECTION, String.format(
            "OVERPAYMENT PROTECTION: Current bid ($%.2f) exceeds 130%% of estimated value ($%.2f). "
            + "Profit is impossible at this price. Strategy: do_not_bid",
            ctx.currentBid(), ctx.estimatedValue())));
    }

    private static Optional<Verdict> checkConcentration(AuctionContext ctx) {
        double maxDomainBudget = ctx.budgetAvailable() * CONCENTRATION_RATIO;
        if (ctx.estimatedValue() <= maxDomainBudget) return Optional.empty();
        return Optional.of(Verdict.block(SafetyRule.PORTFOLIO_CONCENTRATION, String.format(
            "PORTFOLIO CONCENTRATION: Domain value ($%.2f) would consume >50%% of remaining budget ($%.2f). "
            + "Maximum allowed: $%.2f. Strategy: do_not_bid",
            ctx.estimatedValue(), ctx.budgetAvailable(), maxDomainBudget)));
    }

    /**
     * @param rule   the rule that fired; {@code null} when nothing blocked
     * @param reason operator-readable explanation
     */
    public record Verdict(boolean blocked, SafetyRule rule, String reason) {

        static Verdict pass() {
            return new Verdict(false, null, "All safety checks passed. Proceeding to strategy analysis.");
        }

        static Verdict block(SafetyRule rule, String reason) {
            return new Verdict(true, rule, reason);
        }
    }
}
