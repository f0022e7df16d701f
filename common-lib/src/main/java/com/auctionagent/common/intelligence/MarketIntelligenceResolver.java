package com.auctionagent.common.intelligence;

import com.auctionagent.common.model.AuctionContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Enriches an {@link AuctionContext} with statistical priors from a {@link MarketIntelligenceSource}.
 *
 * <h3>Bidder</h3>
 * Exact profile lookup by the last bidder's id. When that misses, bidders whose normalized
 * aggression ({@code avg_bid_increase / 10}, clamped to 0–10) is within ±{@value #AGGRESSION_TOLERANCE}
 * and whose reaction time is within ±{@value #REACTION_TOLERANCE_SEC}s of the live reading form
 * a cluster. If nobody matches both bands, aggression alone is used.
 *
 * <h3>Domain</h3>
 * Four tiers tried in order, first hit wins: exact domain, TLD pattern, value tier
 * (±30% of estimated value), platform-wide average.
 *
 * <h3>Derived scores</h3>
 * Win probability, expected value and a resource-priority score computed from the above.
 *
 * <p>Queries are pure functions of the source tables; the class is thread-safe.
 */
public class MarketIntelligenceResolver {

    public static final double AGGRESSION_TOLERANCE = 2.0;
    public static final double REACTION_TOLERANCE_SEC = 60.0;
    public static final double VALUE_TIER_BAND = 0.30;
    public static final double BUDGET_REFERENCE_RATIO = 0.70;
    public static final double FALLBACK_PRICE_RATIO = 0.65;
    public static final double DEFAULT_VOLATILITY = 0.3;

    static final Set<String> PREMIUM_TLDS = Set.of(".com", ".net", ".org");
    static final Set<String> BUDGET_TLDS  = Set.of(".xyz", ".online", ".site", ".club");

    private final MarketIntelligenceSource source;
    private final List<DomainIntelligenceTier> domainTiers;

    public MarketIntelligenceResolver(MarketIntelligenceSource source) {
        this.source = source;
        this.domainTiers = List.of(this::exactDomain, this::tldPattern,
                                   this::valueTierPattern, this::platformAverage);
    }

    // ── aggregate entry point ───────────────────────────────────────────────

    public MarketIntelligence enrich(AuctionContext ctx) {
        BidderIntelligence bidder = bidderIntelligence(ctx.lastBidderId());

        BehavioralPattern pattern = BehavioralPattern.notFound();
        if (!bidder.found() && ctx.lastBidderId() != null && !ctx.lastBidderId().isBlank()) {
            pattern = behavioralPattern(ctx.bidderAnalysis().aggressionScore(),
                                        ctx.bidderAnalysis().reactionTimeAvg());
        }

        DomainIntelligence domain = domainIntelligence(ctx.domain(), ctx.estimatedValue());
        AuctionArchetype archetype = auctionArchetype();
        WinProbability win = estimateWinProbability(ctx, bidder, pattern, domain);
        ExpectedValueAnalysis ev = expectedValue(ctx, win, domain);

        return new MarketIntelligence(bidder, pattern, domain, archetype, win, ev,
                                      resourceScore(win, ev));
    }

    // ── bidder ──────────────────────────────────────────────────────────────

    public BidderIntelligence bidderIntelligence(String bidderId) {
        if (bidderId == null || bidderId.isBlank()) {
            return BidderIntelligence.notFound();
        }
        return source.findBidder(bidderId)
            .map(BidderIntelligence::from)
            .orElseGet(BidderIntelligence::notFound);
    }

    public BehavioralPattern behavioralPattern(double liveAggression, double liveReactionTime) {
        List<BidderProfile> profiles = source.bidderProfiles();
        if (profiles.isEmpty()) {
            return BehavioralPattern.notFound();
        }

        List<BidderProfile> similar = new ArrayList<>();
        for (BidderProfile p : profiles) {
            if (withinAggression(p, liveAggression)
                    && Math.abs(p.avgReactionTime() - liveReactionTime) <= REACTION_TOLERANCE_SEC) {
                similar.add(p);
            }
        }
        if (similar.isEmpty()) {
            for (BidderProfile p : profiles) {
                if (withinAggression(p, liveAggression)) similar.add(p);
            }
        }
        if (similar.isEmpty()) {
            return BehavioralPattern.notFound();
        }

        double avgWinRate = similar.stream().mapToDouble(BidderProfile::winRate).average().orElse(0);
        double avgLate    = similar.stream().mapToDouble(BidderProfile::lateBidRatio).average().orElse(0);

        BehaviorCluster cluster;
        if (avgWinRate > 0.6) {
            cluster = BehaviorCluster.PROFESSIONAL;
        } else if (avgWinRate < 0.15) {
            cluster = BehaviorCluster.CASUAL;
        } else if (avgLate > 0.7) {
            cluster = BehaviorCluster.SNIPER;
        } else {
            cluster = BehaviorCluster.REGULAR;
        }
        double fold = 1.0 - avgWinRate;

        return new BehavioralPattern(true, cluster, similar.size(), avgWinRate, fold, avgLate,
                                     liveAggression > 6.0, liveAggression < 3.0,
                                     cluster.counterStrategy(fold));
    }

    private static boolean withinAggression(BidderProfile p, double liveAggression) {
        double normalized = clamp(p.avgBidIncrease() / 10.0, 0.0, 10.0);
        return Math.abs(normalized - liveAggression) <= AGGRESSION_TOLERANCE;
    }

    // ── domain (chain of tiers) ─────────────────────────────────────────────

    public DomainIntelligence domainIntelligence(String domain, double estimatedValue) {
        for (DomainIntelligenceTier tier : domainTiers) {
            Optional<DomainIntelligence> hit = tier.match(domain, estimatedValue);
            if (hit.isPresent()) return hit.get();
        }
        return DomainIntelligence.notFound();
    }

    Optional<DomainIntelligence> exactDomain(String domain, double estimatedValue) {
        return source.findDomain(domain).map(d -> new DomainIntelligence(
            true, MatchType.EXACT, 0.95, d.avgFinalPrice(), d.volatility(),
            (int) Math.round(d.avgBids()), true,
            d.volatility() > DomainIntelligence.VOLATILE_THRESHOLD,
            d.tld(), null, null, null, null, null));
    }

    Optional<DomainIntelligence> tldPattern(String domain, double estimatedValue) {
        String tld = DomainStat.tldOf(domain);
        if (tld == null) return Optional.empty();

        List<DomainStat> sameTld = source.domainStats().stream()
            .filter(d -> tld.equals(d.tld()))
            .toList();
        if (sameTld.isEmpty()) return Optional.empty();

        List<Double> prices = sortedPrices(sameTld);
        double avgPrice = mean(prices);
        double avgVolatility = sameTld.stream().mapToDouble(DomainStat::volatility).average().orElse(0);
        int n = sameTld.size();

        PricePercentiles percentiles = new PricePercentiles(
            quantile(prices, 0.25), quantile(prices, 0.50),
            quantile(prices, 0.75), quantile(prices, 0.90));

        return Optional.of(new DomainIntelligence(
            true, MatchType.TLD_PATTERN, Math.min(0.75, n / 50.0), avgPrice, avgVolatility, n, false,
            avgVolatility > DomainIntelligence.VOLATILE_THRESHOLD, tld,
            PREMIUM_TLDS.contains(tld), BUDGET_TLDS.contains(tld), percentiles, null, null));
    }

    Optional<DomainIntelligence> valueTierPattern(String domain, double estimatedValue) {
        if (estimatedValue <= 0) return Optional.empty();
        double lower = estimatedValue * (1 - VALUE_TIER_BAND);
        double upper = estimatedValue * (1 + VALUE_TIER_BAND);

        List<DomainStat> inBand = source.domainStats().stream()
            .filter(d -> d.avgFinalPrice() >= lower && d.avgFinalPrice() <= upper)
            .toList();
        if (inBand.isEmpty()) return Optional.empty();

        List<Double> prices = sortedPrices(inBand);
        double median = quantile(prices, 0.50);
        int n = inBand.size();

        return Optional.of(new DomainIntelligence(
            true, MatchType.VALUE_TIER, Math.min(0.9, n / 100.0), mean(prices), null, n, false,
            null, null, null, null, null, median * 0.85, null));
    }

    Optional<DomainIntelligence> platformAverage(String domain, double estimatedValue) {
        List<DomainStat> all = source.domainStats();
        if (all.isEmpty()) return Optional.empty();
        double avg = all.stream().mapToDouble(DomainStat::avgFinalPrice).average().orElse(0);
        return Optional.of(new DomainIntelligence(
            true, MatchType.PLATFORM_AVERAGE, 0.30, avg, null, all.size(), false,
            null, null, null, null, null, null,
            "Using platform-wide average. Low confidence."));
    }

    // ── archetype ───────────────────────────────────────────────────────────

    public AuctionArchetype auctionArchetype() {
        List<ArchetypeStat> rows = source.auctionArchetypes();
        if (rows.isEmpty()) {
            return AuctionArchetype.notFound();
        }
        double late = rows.stream().mapToDouble(ArchetypeStat::lateBidRatio).average().orElse(0);
        double jump = rows.stream().mapToDouble(ArchetypeStat::avgBidJump).average().orElse(0);
        double duration = rows.stream().mapToDouble(ArchetypeStat::durationSec).average().orElse(0);
        return new AuctionArchetype(true, jump > 50 ? "fast" : "slow",
                                    late > 0.7, late < 0.3, late, jump, duration);
    }

    // ── derived scores ──────────────────────────────────────────────────────

    /**
     * Competition prior, then in order: opponent win rate, cluster fold tendency,
     * budget adequacy, domain volatility. Clamped to [0.05, 0.95].
     */
    public WinProbability estimateWinProbability(AuctionContext ctx, BidderIntelligence bidder,
                                                 BehavioralPattern pattern, DomainIntelligence domain) {
        double p = switch (Math.min(ctx.numBidders(), 3)) {
            case 0 -> 0.95;
            case 1 -> 0.70;
            case 2 -> 0.50;
            default -> 0.30;
        };

        if (bidder.found()) {
            p *= (1 - bidder.winRate() * 0.5);
        }
        if (pattern.found()) {
            p += (pattern.foldProbability() - 0.5) * 0.2;
        }

        double reference = ctx.estimatedValue() * BUDGET_REFERENCE_RATIO;
        double budgetAdequacy = reference > 0 ? ctx.budgetAvailable() / reference : 1.0;
        if (reference > 0 && ctx.budgetAvailable() < reference) {
            p *= (0.5 + 0.5 * budgetAdequacy);
        }

        double volatility = domain.volatilityOr(0.0);
        if (domain.found() && volatility > DomainIntelligence.VOLATILE_THRESHOLD) {
            p *= 0.90;
        }

        double finalP = clamp(p, 0.05, 0.95);
        String level = finalP > 0.7 ? "high" : finalP > 0.4 ? "medium" : "low";

        return new WinProbability(finalP, level, ctx.numBidders(),
            bidder.found() ? 1 - bidder.winRate() : 0.5,
            budgetAdequacy,
            domain.found() && domain.priceVolatility() != null ? 1 - domain.priceVolatility() : 0.5);
    }

    public ExpectedValueAnalysis expectedValue(AuctionContext ctx, WinProbability win,
                                               DomainIntelligence domain) {
        double expectedPrice = domain.found() && domain.averageFinalPrice() != null
                               && domain.averageFinalPrice() > 0
            ? domain.averageFinalPrice()
            : ctx.estimatedValue() * FALLBACK_PRICE_RATIO;

        double profit = ctx.estimatedValue() - expectedPrice;
        double margin = ctx.estimatedValue() > 0 ? profit / ctx.estimatedValue() : 0.0;
        double ev = win.probability() * profit;
        double riskAdjusted = ev * (1 - domain.volatilityOr(DEFAULT_VOLATILITY) * 0.5);
        double roi = expectedPrice > 0 ? riskAdjusted / expectedPrice : 0.0;

        BidRecommendation rec = roi > 1.5 ? BidRecommendation.STRONG_BID
                              : roi > 0.8 ? BidRecommendation.MODERATE_BID
                              : BidRecommendation.WEAK_BID;

        return new ExpectedValueAnalysis(expectedPrice, profit, margin, ev, riskAdjusted, roi, rec);
    }

    public ResourceScore resourceScore(WinProbability win, ExpectedValueAnalysis ev) {
        double score = win.probability() * ev.expectedMargin() * (1 + ev.roi());
        ResourcePriority priority = score > 1.0 ? ResourcePriority.HIGH
                                  : score > 0.5 ? ResourcePriority.MEDIUM
                                  : ResourcePriority.LOW;
        String explanation = String.format("Win prob %.1f%% × Margin %.1f%% × ROI %.2f = %.3f",
            win.probability() * 100, ev.expectedMargin() * 100, ev.roi(), score);
        return new ResourceScore(score, priority, priority.action(), explanation);
    }

    // ── helpers ─────────────────────────────────────────────────────────────

    private static List<Double> sortedPrices(List<DomainStat> stats) {
        List<Double> prices = new ArrayList<>(stats.size());
        for (DomainStat d : stats) prices.add(d.avgFinalPrice());
        Collections.sort(prices);
        return prices;
    }

    private static double mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0);
    }

    /** Linear-interpolated quantile over an ascending list. */
    static double quantile(List<Double> sorted, double q) {
        if (sorted.isEmpty()) return 0.0;
        double pos = q * (sorted.size() - 1);
        int lo = (int) Math.floor(pos);
        int hi = (int) Math.ceil(pos);
        double frac = pos - lo;
        return sorted.get(lo) + (sorted.get(hi) - sorted.get(lo)) * frac;
    }

    private static double clamp(double v, double min, double max) {
        return Math.max(min, Math.min(max, v));
    }
}
