package com.auctionagent.history.service;

import com.auctionagent.common.history.AuctionOutcome;
import com.auctionagent.common.history.AuctionRoundRecord;
import com.auctionagent.common.history.HistoryStore;
import com.auctionagent.common.history.StrategyPerformance;
import com.auctionagent.common.model.AuctionResult;
import com.auctionagent.common.model.DecisionSource;
import com.auctionagent.common.model.Platform;
import com.auctionagent.common.model.Strategy;
import com.auctionagent.common.model.ValueTier;
import com.auctionagent.history.model.AuctionOutcomeEntity;
import com.auctionagent.history.model.AuctionRoundEntity;
import com.auctionagent.history.model.StrategyPerformanceEntity;
import com.auctionagent.history.repository.AuctionOutcomeRepository;
import com.auctionagent.history.repository.AuctionRoundRepository;
import com.auctionagent.history.repository.StrategyPerformanceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * SQL-backed {@link HistoryStore}.
 *
 * <p>Outcomes and rounds are upserted on their natural keys. After an outcome write the
 * strategy aggregate of its {@code (strategy, platform, value_tier)} group is rebuilt from
 * the outcome table, together with the group the row belonged to before, if it moved.
 */
@Service
public class AuctionHistoryService implements HistoryStore {

    private static final Logger log = LoggerFactory.getLogger(AuctionHistoryService.class);

    private final AuctionOutcomeRepository outcomeRepository;
    private final AuctionRoundRepository roundRepository;
    private final StrategyPerformanceRepository performanceRepository;

    public AuctionHistoryService(AuctionOutcomeRepository outcomeRepository,
                                 AuctionRoundRepository roundRepository,
                                 StrategyPerformanceRepository performanceRepository) {
        this.outcomeRepository     = outcomeRepository;
        this.roundRepository       = roundRepository;
        this.performanceRepository = performanceRepository;
    }

    // ── writes ───────────────────────────────────────────────────────────────

    @Override
    public Mono<Void> recordOutcome(AuctionOutcome outcome) {
        return outcomeRepository.findById(outcome.auctionId())
            .map(Optional::of)
            .defaultIfEmpty(Optional.empty())
            .flatMap(previous -> upsert(outcome).then(recomputeAggregates(outcome, previous)))
            .doOnSuccess(v -> log.info("[History] Outcome recorded. auctionId={} domain={} result={} strategy={}",
                outcome.auctionId(), outcome.domain(), outcome.result().wire(),
                outcome.strategyUsed() != null ? outcome.strategyUsed().wire() : null))
            .doOnError(e -> log.error("[History] Failed to record outcome. auctionId={}", outcome.auctionId(), e));
    }

    private Mono<Void> upsert(AuctionOutcome o) {
        return outcomeRepository.upsertOutcome(
            o.auctionId(), o.domain(), wire(o.platform()), toLocal(o.timestamp()),
            o.estimatedValue(), o.currentBidAtDecision(), o.finalPrice(), o.numBidders(),
            o.hoursRemainingAtDecision(), o.botDetected(), wire(o.strategyUsed()),
            o.recommendedBid(), wire(o.decisionSource()), o.confidence(),
            o.result().wire(), o.profitMargin(), o.opponentHash(), o.valueTier().wire());
    }

    private Mono<Void> recomputeAggregates(AuctionOutcome outcome, Optional<AuctionOutcomeEntity> previous) {
        Set<GroupKey> keys = new LinkedHashSet<>();
        GroupKey.of(wire(outcome.strategyUsed()), wire(outcome.platform()), outcome.valueTier().wire())
            .ifPresent(keys::add);
        previous.flatMap(p -> GroupKey.of(p.getStrategyUsed(), p.getPlatform(), p.getValueTier()))
            .ifPresent(keys::add);

        return Flux.fromIterable(keys)
            .concatMap(k -> performanceRepository.recompute(k.strategy(), k.platform(), k.valueTier()))
            .then();
    }

    @Override
    public Mono<Void> recordRound(AuctionRoundRecord round) {
        return roundRepository.upsertRound(
                round.threadId(), round.roundNumber(), round.domain(), wire(round.platform()),
                round.estimatedValue(), round.currentBidAtDecision(), wire(round.strategyUsed()),
                round.recommendedBid(), wire(round.decisionSource()), round.confidence(),
                round.resultRound(), toLocal(round.timestamp()))
            .doOnSuccess(v -> log.info("[History] Round recorded. threadId={} round={} domain={}",
                round.threadId(), round.roundNumber(), round.domain()))
            .doOnError(e -> log.error("[History] Failed to record round. threadId={} round={}",
                round.threadId(), round.roundNumber(), e));
    }

    // ── reads ────────────────────────────────────────────────────────────────

    @Override
    public Flux<AuctionOutcome> getSimilarAuctions(Platform platform, double valueMin, double valueMax, int limit) {
        return outcomeRepository.findSimilar(platform.wire(), valueMin, valueMax, limit)
            .map(AuctionHistoryService::toOutcome);
    }

    @Override
    public Mono<StrategyPerformance> getStrategyPerformance(Strategy strategy, Platform platform, ValueTier valueTier) {
        return performanceRepository.findByStrategy(strategy.wire())
            .filter(e -> platform == null || platform.wire().equals(e.getPlatform()))
            .filter(e -> valueTier == null || valueTier.wire().equals(e.getValueTier()))
            .collectList()
            .map(rows -> StrategyPerformance.of(strategy, platform, valueTier,
                rows.stream().mapToLong(StrategyPerformanceEntity::getTotalUses).sum(),
                rows.stream().mapToLong(StrategyPerformanceEntity::getWins).sum(),
                rows.stream().mapToDouble(StrategyPerformanceEntity::getTotalProfit).sum()));
    }

    @Override
    public Mono<Strategy> getBestStrategyForContext(Platform platform, ValueTier valueTier, int minSamples) {
        return performanceRepository.findBest(platform.wire(), valueTier.wire(), minSamples)
            .map(e -> Strategy.fromWire(e.getStrategy()));
    }

    @Override
    public Flux<AuctionRoundRecord> getRoundsForThread(String threadId) {
        return roundRepository.findByThreadIdOrderByRoundNumberAsc(threadId)
            .map(AuctionHistoryService::toRound);
    }

    @Override
    public Mono<Integer> nextRoundNumber(String threadId) {
        return roundRepository.nextRoundNumber(threadId)
            .defaultIfEmpty(1);
    }

    // ── mapping ──────────────────────────────────────────────────────────────

    static AuctionOutcome toOutcome(AuctionOutcomeEntity e) {
        return new AuctionOutcome(e.getAuctionId(), e.getDomain(),
            e.getPlatform() != null ? Platform.fromWire(e.getPlatform()) : null,
            toInstant(e.getRecordedAt()), e.getEstimatedValue(), e.getCurrentBidAtDecision(),
            e.getFinalPrice(), e.getNumBidders(), e.getHoursRemainingAtDecision(), e.isBotDetected(),
            e.getStrategyUsed() != null ? Strategy.fromWire(e.getStrategyUsed()) : null,
            e.getRecommendedBid(),
            e.getDecisionSource() != null ? DecisionSource.fromWire(e.getDecisionSource()) : null,
            e.getConfidence(), AuctionResult.fromWire(e.getResult()), e.getProfitMargin(), e.getOpponentHash());
    }

    static AuctionRoundRecord toRound(AuctionRoundEntity e) {
        return new AuctionRoundRecord(e.getThreadId(), e.getRoundNumber(), e.getDomain(),
            e.getPlatform() != null ? Platform.fromWire(e.getPlatform()) : null,
            e.getEstimatedValue(), e.getCurrentBidAtDecision(),
            e.getStrategyUsed() != null ? Strategy.fromWire(e.getStrategyUsed()) : null,
            e.getRecommendedBid(),
            e.getDecisionSource() != null ? DecisionSource.fromWire(e.getDecisionSource()) : null,
            e.getConfidence(), e.getResultRound(), toInstant(e.getRecordedAt()));
    }

    private static String wire(Platform p)       { return p == null ? null : p.wire(); }
    private static String wire(Strategy s)       { return s == null ? null : s.wire(); }
    private static String wire(DecisionSource d) { return d == null ? null : d.wire(); }

    private static LocalDateTime toLocal(Instant instant) {
        return LocalDateTime.ofInstant(instant != null ? instant : Instant.now(), ZoneOffset.UTC);
    }

    private static Instant toInstant(LocalDateTime time) {
        return time == null ? null : time.toInstant(ZoneOffset.UTC);
    }

    private record GroupKey(String strategy, String platform, String valueTier) {
        static Optional<GroupKey> of(String strategy, String platform, String valueTier) {
            if (strategy == null || platform == null || valueTier == null) return Optional.empty();
            return Optional.of(new GroupKey(strategy, platform, valueTier));
        }
    }
}
