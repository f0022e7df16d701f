package com.auctionagent.common.history;

import com.auctionagent.common.model.Platform;
import com.auctionagent.common.model.Strategy;
import com.auctionagent.common.model.ValueTier;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Persistent record of auction outcomes, rounds and per-strategy aggregates.
 *
 * <p>Writes are idempotent upserts on natural keys: {@code auction_id} for outcomes,
 * {@code (thread_id, round_number)} for rounds. Recording the same key twice updates
 * the stored row and leaves strategy aggregates as if it had been recorded once.
 */
public interface HistoryStore {

    Mono<Void> recordOutcome(AuctionOutcome outcome);

    Mono<Void> recordRound(AuctionRoundRecord round);

    /** Most recent first. */
    Flux<AuctionOutcome> getSimilarAuctions(Platform platform, double valueMin, double valueMax, int limit);

    /**
     * @param platform  {@code null} aggregates across platforms
     * @param valueTier {@code null} aggregates across tiers
     * @return aggregate, with zero uses when nothing was recorded
     */
    Mono<StrategyPerformance> getStrategyPerformance(Strategy strategy, Platform platform, ValueTier valueTier);

    /** Highest win rate among strategies with at least {@code minSamples} uses; empty when none qualifies. */
    Mono<Strategy> getBestStrategyForContext(Platform platform, ValueTier valueTier, int minSamples);

    /** Ordered by round number. */
    Flux<AuctionRoundRecord> getRoundsForThread(String threadId);

    /**
     * Number the next round of {@code threadId} takes: the highest stored round plus one,
     * or 1 for a new thread. Errors propagate; callers number writes from this value.
     */
    Mono<Integer> nextRoundNumber(String threadId);
}
