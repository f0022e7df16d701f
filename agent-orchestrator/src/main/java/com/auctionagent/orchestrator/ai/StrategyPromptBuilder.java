package com.auctionagent.orchestrator.ai;

import com.auctionagent.common.history.AuctionRoundRecord;
import com.auctionagent.common.history.HistoricalContext;
import com.auctionagent.common.history.StrategyPerformance;
import com.auctionagent.common.intelligence.BehavioralPattern;
import com.auctionagent.common.intelligence.BidderIntelligence;
import com.auctionagent.common.intelligence.DomainIntelligence;
import com.auctionagent.common.intelligence.MarketIntelligence;
import com.auctionagent.common.model.AuctionContext;
import com.auctionagent.common.model.BidderAnalysis;
import com.auctionagent.common.model.Platform;
import com.auctionagent.common.model.ValueTier;
import com.auctionagent.common.validation.ValidationPolicy;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Builds the system and user prompts for the strategy oracle.
 *
 * <p>Financial bounds in the prompt come from the same {@link ValidationPolicy} the validator
 * enforces, so the oracle is never told a ceiling the validator would reject.
 */
@Component
public class StrategyPromptBuilder {

    static final String SYSTEM_PROMPT = """
        # Domain Auction Strategy

        You are a domain auction strategist. You understand proxy bidding on GoDaddy, NameJet
        and Dynadot, late-bid extensions and minimum increments, bidder psychology, bot
        detection, and profit margin management.

        ## Principles
        1. Profit first: a good buy leaves a margin against estimated value.
        2. Never recommend a bid above the hard ceiling given in the auction context.
        3. Respect platform timing rules.
        4. Adapt to opponents: bots, professionals and casual bidders need different play.

        ## Strategies
        - proxy_max: set a maximum proxy, let the platform auto-bid
        - last_minute_snipe: bid in the final moments to deny counters
        - incremental_test: small bids to probe the competition
        - wait_for_closeout: let the auction close with minimal bids
        - aggressive_early: rare, must-have domains only
        - do_not_bid: walk away when profit is impossible (bid must be 0)

        ## Platform rules
        %s

        ## Framework
        - Value tier: high ($1000+) conservative, medium ($100-1000) balanced, low (<$100) cheap or closeout
        - Competition: 0 bidders closeout or early proxy, 1-2 proxy within limits, 3+ snipe or probe
        - Bots: prefer sniping to shrink their reaction window
        - Time: >1h position, <1h execute, <5 min snipe with extension awareness
        """;

    private final ValidationPolicy policy;

    public StrategyPromptBuilder(ValidationPolicy policy) {
        this.policy = policy;
    }

    public String systemPrompt() {
        StringBuilder rules = new StringBuilder();
        for (Platform p : Platform.values()) {
            rules.append("- ").append(p.ruleSummary()).append('\n');
        }
        return SYSTEM_PROMPT.formatted(rules.toString().trim());
    }

    public String userPrompt(AuctionContext ctx, MarketIntelligence intel, HistoricalContext history) {
        BidderAnalysis ba = ctx.bidderAnalysis();
        double safeMax = ctx.estimatedValue();
        double ceiling = policy.ceilingFor(ctx.estimatedValue());

        return """
            ## Auction
            Domain: %s
            Platform: %s (%s)

            Financials:
            - Estimated value: $%.2f
            - Current bid: $%.2f
            - Your current proxy: $%.2f (0 = none)
            - Budget available: $%.2f
            - Safe max (100%% of value): $%.2f
            - Hard ceiling (%.0f%% of value): $%.2f

            Competition:
            - Active bidders: %d
            - Hours remaining: %.1f

            Bidder analysis:
            - Bot detected: %s
            - Corporate buyer: %s
            - Aggression: %.1f/10
            - Avg reaction time: %.1fs

            Value tier: %s - %s
            %s%s
            ## Task
            Recommend the bidding strategy. Weigh profit potential, competition, platform mechanics,
            overpayment risk and timing.

            Reply with ONLY a JSON object:
            {"strategy":"proxy_max|last_minute_snipe|incremental_test|wait_for_closeout|aggressive_early|do_not_bid","recommended_bid_amount":<number>,"confidence":<0.0-1.0>,"risk_level":"low|medium|high","reasoning":"<at least %d characters covering profit, risk, competition and strategy>"}

            recommended_bid_amount is the proxy maximum you would set, not the next visible bid.
            It must not exceed $%.2f or the available budget.
            """.formatted(
                ctx.domain(), ctx.platform().wire().toUpperCase(), ctx.platform().ruleSummary(),
                ctx.estimatedValue(), ctx.currentBid(), ctx.yourCurrentProxy(), ctx.budgetAvailable(),
                safeMax, policy.bidCeilingRatio() * 100, ceiling,
                ctx.numBidders(), ctx.hoursRemaining(),
                ba.botDetected(), ba.corporateBuyer(), ba.aggressionScore(), ba.reactionTimeAvg(),
                ctx.valueTier().name(), tierNote(ctx.valueTier()),
                intelligenceSection(intel), historySection(history),
                policy.recommendedReasoningLength(), Math.min(ceiling, ctx.budgetAvailable()));
    }

    // ── sections ────────────────────────────────────────────────────────────

    private String tierNote(ValueTier tier) {
        return switch (tier) {
            case HIGH   -> "conservative, avoid emotional escalation";
            case MEDIUM -> "balanced, test the competition";
            case LOW    -> "cheap entry or wait for closeout";
        };
    }

    String intelligenceSection(MarketIntelligence intel) {
        if (intel == null) return "";
        StringBuilder sb = new StringBuilder("\nMarket intelligence:\n");

        BidderIntelligence bidder = intel.bidder();
        BehavioralPattern pattern = intel.behavioralPattern();
        if (bidder != null && bidder.found()) {
            sb.append(String.format("- Last bidder: %d auctions, win rate %.0f%%, aggressive=%s, sniper=%s, proxy-heavy=%s%n",
                bidder.totalAuctions(), bidder.winRate() * 100, bidder.aggressive(), bidder.sniper(),
                bidder.proxyHeavy()));
        } else if (pattern != null && pattern.found()) {
            sb.append(String.format("- Bidder cluster: %s (n=%d), fold probability %.0f%%, win rate %.0f%%. Advice: %s%n",
                pattern.cluster().wire(), pattern.sampleSize(), pattern.foldProbability() * 100,
                pattern.avgWinRate() * 100, pattern.counterStrategy()));
        }

        DomainIntelligence domain = intel.domain();
        if (domain != null && domain.found()) {
            sb.append(String.format("- Domain prices (%s, confidence %.2f): avg final $%.2f",
                domain.matchType().wire(), domain.confidence(), domain.averageFinalPrice()));
            if (domain.isVolatile() != null) sb.append(", volatile=").append(domain.isVolatile());
            if (domain.recommendedMaxBid() != null) {
                sb.append(String.format(", suggested max $%.2f", domain.recommendedMaxBid()));
            }
            if (domain.warning() != null) sb.append(". ").append(domain.warning());
            sb.append('\n');
        }

        if (intel.archetype() != null && intel.archetype().found()) {
            sb.append(String.format("- Auction archetype: %s escalation, sniper-dominated=%s, proxy-driven=%s%n",
                intel.archetype().escalationSpeed(), intel.archetype().sniperDominated(),
                intel.archetype().proxyDriven()));
        }
        if (intel.winProbability() != null) {
            sb.append(String.format("- Win probability: %.0f%% (%s)%n",
                intel.winProbability().probability() * 100, intel.winProbability().confidenceLevel()));
        }
        if (intel.expectedValue() != null) {
            sb.append(String.format("- Expected final price $%.2f, ROI %.2f, %s%n",
                intel.expectedValue().expectedFinalPrice(), intel.expectedValue().roi(),
                intel.expectedValue().recommendation()));
        }
        if (intel.resourceScore() != null) {
            sb.append(String.format("- Priority %s: %s%n",
                intel.resourceScore().priority(), intel.resourceScore().actionRecommendation()));
        }
        return sb.toString();
    }

    String historySection(HistoricalContext history) {
        if (history == null || !history.hasData()) return "";
        StringBuilder sb = new StringBuilder("\nHistory:\n");

        if (history.insights().hasData()) {
            sb.append(String.format("- %d similar auctions, win rate %.0f%%%n",
                history.insights().totalSimilar(), history.insights().winRate() * 100));
            if (history.insights().priceRatioInsight() != null) {
                sb.append("- ").append(history.insights().priceRatioInsight()).append('\n');
            }
        }
        for (Map.Entry<?, StrategyPerformance> e : history.strategyPerformance().entrySet()) {
            StrategyPerformance p = e.getValue();
            sb.append(String.format("- %s: %d uses, win rate %.0f%%, avg profit per win $%.2f%n",
                p.strategy().wire(), p.totalUses(), p.winRate() * 100, p.avgProfitPerWin()));
        }
        if (history.bestStrategy() != null) {
            sb.append("- Historically best strategy: ").append(history.bestStrategy().wire()).append('\n');
        }
        if (!history.sameAuctionAttempts().isEmpty()) {
            sb.append("Previous rounds of this auction:\n");
            for (AuctionRoundRecord r : history.sameAuctionAttempts()) {
                sb.append(String.format("  round %d: %s at $%.2f (bid was $%.2f) -> %s%n",
                    r.roundNumber(), r.strategyUsed() != null ? r.strategyUsed().wire() : "?",
                    r.recommendedBid(), r.currentBidAtDecision(),
                    r.resultRound() != null ? r.resultRound() : "pending"));
            }
        }
        return sb.toString();
    }
}
