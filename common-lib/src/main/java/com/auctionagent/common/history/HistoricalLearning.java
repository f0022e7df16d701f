package com.auctionagent.common.history;

import com.auctionagent.common.model.AuctionContext;
import com.auctionagent.common.model.Strategy;
import com.auctionagent.common.model.ValueTier;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link HistoricalContext} for an auction from a {@link HistoryStore}.
 *
 * <p>Similar auctions are those on the same platform within ±{@value #SIMILAR_VALUE_BAND}
 * of the estimated value, capped at {@value #SIMILAR_LIMIT}.
 */
public class HistoricalLearning {

    public static final double SIMILAR_VALUE_BAND = 0.30;
    public static final int SIMILAR_LIMIT = 10;
    public static final int BEST_STRATEGY_MIN_SAMPLES = 5;

    static final List<Strategy> TRACKED_STRATEGIES = List.of(
        Strategy.PROXY_MAX, Strategy.LAST_MINUTE_SNIPE, Strategy.INCREMENTAL_TEST,
        Strategy.WAIT_FOR_CLOSEOUT, Strategy.AGGRESSIVE_EARLY);

    private final HistoryStore store;

    public HistoricalLearning(HistoryStore store) {
        this.store = store;
    }

    public Mono<HistoricalContext> historicalContext(AuctionContext ctx) {
        ValueTier tier = ctx.valueTier();
        double band = ctx.estimatedValue() * SIMILAR_VALUE_BAND;

        Mono<List<AuctionOutcome>> similar = store
            .getSimilarAuctions(ctx.platform(), ctx.estimatedValue() - band,
                                ctx.estimatedValue() + band, SIMILAR_LIMIT)
            .collectList();

        Mono<Map<Strategy, StrategyPerformance>> performance = Flux.fromIterable(TRACKED_STRATEGIES)
            .concatMap(s -> store.getStrategyPerformance(s, ctx.platform(), tier))
            .filter(p -> p.totalUses() > 0)
            .collectMap(StrategyPerformance::strategy, p -> p, () -> new EnumMap<>(Strategy.class));

        Mono<List<Strategy>> best = store
            .getBestStrategyForContext(ctx.platform(), tier, BEST_STRATEGY_MIN_SAMPLES)
            .map(List::of)
            .defaultIfEmpty(List.of());

        Mono<List<AuctionRoundRecord>> rounds = ctx.threadId() == null || ctx.threadId().isBlank()
            ? Mono.just(List.of())
            : store.getRoundsForThread(ctx.threadId()).collectList();

        return Mono.zip(similar, performance, best, rounds)
            .map(t -> new HistoricalContext(tier, t.getT1().size(), insights(t.getT1()), t.getT2(),
                                            t.getT3().isEmpty() ? null : t.getT3().get(0), t.getT4()));
    }

    /** Win rate, price ratio and winning-strategy counts over {@code auctions}. */
    public static HistoricalInsights insights(List<AuctionOutcome> auctions) {
        if (auctions == null || auctions.isEmpty()) {
            return HistoricalInsights.none();
        }

        long wins = auctions.stream().filter(AuctionOutcome::won).count();
        double winRate = (double) wins / auctions.size();

        List<Double> ratios = new ArrayList<>();
        for (AuctionOutcome a : auctions) {
            if (a.finalPrice() != null && a.finalPrice() > 0 && a.estimatedValue() > 0) {
                ratios.add(a.finalPrice() / a.estimatedValue());
            }
        }
        Double avgRatio = ratios.isEmpty() ? null
            : ratios.stream().mapToDouble(Double::doubleValue).average().orElse(0);
        String ratioInsight = avgRatio == null ? null : String.format(
            "Similar domains typically sold for %.0f%% of estimated value.", avgRatio * 100);

        Map<String, Long> winning = new LinkedHashMap<>();
        for (AuctionOutcome a : auctions) {
            if (a.won()) {
                String key = a.strategyUsed() != null ? a.strategyUsed().wire() : "unknown";
                winning.merge(key, 1L, Long::sum);
            }
        }

        return new HistoricalInsights(true, auctions.size(), winRate, avgRatio, ratioInsight, winning);
    }
}
