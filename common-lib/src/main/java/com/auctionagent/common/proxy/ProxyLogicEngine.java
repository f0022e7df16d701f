package com.auctionagent.common.proxy;

import com.auctionagent.common.model.AuctionContext;
import com.auctionagent.common.model.ProxyAction;
import com.auctionagent.common.model.ProxyDecision;
import com.auctionagent.common.model.Strategy;
import com.auctionagent.common.model.StrategyDecision;

/**
 * Turns a chosen strategy into a concrete proxy adjustment and has the last word on
 * whether the auction can still be won at a profit.
 *
 * <p>Evaluated in order:
 * <ol>
 *   <li>{@code currentBid >= safeMax} → accept the loss. The strategy is forced to {@code do_not_bid}.</li>
 *   <li>No proxy set → initialise at {@code min(safeMax, budget, estimatedValue)}, bid one increment up.</li>
 *   <li>Otherwise raise the proxy only if the headroom over the current proxy is at least
 *       {@value #MIN_INCREMENTS_TO_RAISE} increments, else keep it.</li>
 * </ol>
 *
 * <p>The accept-loss override is unconditional. A {@code do_not_bid} decision that is not an
 * accept-loss keeps the current proxy: {@link #process} reports {@code maintain_proxy} with no
 * next bid and a zero budget, so the decision never carries raise instructions. This class is
 * stateless, pure and thread-safe.
 */
public final class ProxyLogicEngine {

    public static final double SAFE_MAX_RATIO = 1.00;
    public static final int MIN_INCREMENTS_TO_RAISE = 3;

    private ProxyLogicEngine() {}

    /** Analyses the context and applies the result to {@code decision}. */
    public static Outcome process(AuctionContext ctx, StrategyDecision decision) {
        ProxyDecision proxy = analyze(ctx);
        if (decision.strategy() == Strategy.DO_NOT_BID && proxy.proxyAction() != ProxyAction.ACCEPT_LOSS) {
            proxy = standDown(proxy);
        }
        return new Outcome(proxy, apply(decision, proxy));
    }

    private static ProxyDecision standDown(ProxyDecision proxy) {
        return new ProxyDecision(proxy.currentProxy(), proxy.currentBid(), proxy.safeMax(), false, null, null, 0.0,
            ProxyAction.MAINTAIN_PROXY, String.format(
                "NO BID: strategy is do_not_bid. Current proxy $%.2f is left as is against bid $%.2f.",
                proxy.currentProxy(), proxy.currentBid()));
    }

    public static ProxyDecision analyze(AuctionContext ctx) {
        double safeMax      = ctx.estimatedValue() * SAFE_MAX_RATIO;
        double currentBid   = ctx.currentBid();
        double currentProxy = ctx.yourCurrentProxy();
        double increment    = ctx.platform().bidIncrement(currentBid);
        double potential    = Math.min(Math.min(safeMax, ctx.budgetAvailable()), ctx.estimatedValue());

        if (currentBid >= safeMax) {
            return new ProxyDecision(currentProxy, currentBid, safeMax, false, null, null, 0.0,
                ProxyAction.ACCEPT_LOSS, String.format(
                    "PROFIT IMPOSSIBLE: current bid $%.2f has reached safe max $%.2f. "
                    + "Current proxy $%.2f cannot be raised without overpaying; accept the loss.",
                    currentBid, safeMax, currentProxy));
        }

        if (!ctx.hasProxy()) {
            double next = currentBid + increment;
            return new ProxyDecision(currentProxy, currentBid, safeMax, true, potential, next, potential,
                ProxyAction.INCREASE_PROXY, String.format(
                    "INITIAL PROXY SETUP: no proxy set. Safe max $%.2f (100%% of $%.2f). "
                    + "Setting proxy to $%.2f; next visible bid $%.2f ($%.2f + $%.2f increment). "
                    + "Cost can never exceed $%.2f even if fully contested.",
                    safeMax, ctx.estimatedValue(), potential, next, currentBid, increment, potential));
        }

        if (potential >= currentProxy + MIN_INCREMENTS_TO_RAISE * increment) {
            double next = currentBid + increment;
            return new ProxyDecision(currentProxy, currentBid, safeMax, true, potential, next, potential,
                ProxyAction.INCREASE_PROXY, String.format(
                    "PROXY INCREASE: safe max $%.2f is above current bid $%.2f and proxy $%.2f leaves headroom. "
                    + "Raising proxy to $%.2f; next visible bid $%.2f ($%.2f + $%.2f increment).",
                    safeMax, currentBid, currentProxy, potential, next, currentBid, increment));
        }

        return new ProxyDecision(currentProxy, currentBid, safeMax, false, null, null, currentProxy,
            ProxyAction.MAINTAIN_PROXY, String.format(
                "PROXY ADEQUATE: current proxy $%.2f is within %d increments of the $%.2f ceiling "
                + "against bid $%.2f. No change needed.",
                currentProxy, MIN_INCREMENTS_TO_RAISE, potential, currentBid));
    }

    /**
     * Copies sizing fields from {@code proxy} onto {@code decision}; on accept-loss also forces
     * {@code do_not_bid}.
     */
    public static StrategyDecision apply(StrategyDecision decision, ProxyDecision proxy) {
        if (proxy.proxyAction() == ProxyAction.ACCEPT_LOSS) {
            return decision.overriddenToDoNotBid(proxy.explanation());
        }
        return decision.withProxyFields(proxy);
    }

    public record Outcome(ProxyDecision proxy, StrategyDecision decision) {}
}
