package com.auctionagent.orchestrator.service;

import com.auctionagent.common.history.AuctionOutcome;
import com.auctionagent.common.history.AuctionRoundRecord;
import com.auctionagent.common.history.HistoricalContext;
import com.auctionagent.common.history.HistoricalLearning;
import com.auctionagent.common.history.HistoryStore;
import com.auctionagent.common.intelligence.MarketIntelligence;
import com.auctionagent.common.intelligence.MarketIntelligenceResolver;
import com.auctionagent.common.model.AuctionContext;
import com.auctionagent.common.model.FinalDecision;
import com.auctionagent.common.model.OracleResult;
import com.auctionagent.common.pipeline.PipelineState;
import com.auctionagent.common.pipeline.StrategyOracle;
import com.auctionagent.common.trace.TraceContextUtil;
import com.auctionagent.orchestrator.model.OutcomeRequest;
import com.auctionagent.orchestrator.model.RoundRequest;
import com.auctionagent.orchestrator.pipeline.DecisionPipelineEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Optional;

/**
 * Reactive coordinator for one decision run: safety gate, enrichment, history lookup,
 * oracle call, then validation/fallback/proxy via {@link DecisionPipelineEngine}.
 *
 * <p>{@link #decide} never errors. Enrichment and history failures degrade to empty context,
 * as does a history lookup slower than {@code history.read-timeout-ms}; anything else becomes
 * a {@code system_error} decision.
 */
@Service
public class AuctionDecisionService {

    private static final Logger log = LoggerFactory.getLogger(AuctionDecisionService.class);

    private final DecisionPipelineEngine engine;
    private final MarketIntelligenceResolver intelligenceResolver;
    private final HistoricalLearning historicalLearning;
    private final StrategyOracle oracle;
    private final HistoryStore historyStore;
    private final DecisionStats stats;
    private final Duration historyTimeout;

    public AuctionDecisionService(DecisionPipelineEngine engine,
                                  MarketIntelligenceResolver intelligenceResolver,
                                  HistoricalLearning historicalLearning,
                                  StrategyOracle oracle,
                                  HistoryStore historyStore,
                                  DecisionStats stats,
                                  @Value("${history.read-timeout-ms:3000}") long historyTimeoutMs) {
        this.engine               = engine;
        this.intelligenceResolver = intelligenceResolver;
        this.historicalLearning   = historicalLearning;
        this.oracle               = oracle;
        this.historyStore         = historyStore;
        this.stats                = stats;
        this.historyTimeout       = Duration.ofMillis(historyTimeoutMs);
    }

    public Mono<FinalDecision> decide(AuctionContext ctx) {
        return decide(ctx, TraceContextUtil.newTraceId());
    }

    public Mono<FinalDecision> decide(AuctionContext ctx, String traceId) {
        Mono<FinalDecision> pipeline = Mono.defer(() -> {
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[AuctionDecision] Decision started. domain={} platform={} value={} bid={} traceId={}",
                    ctx.domain(), ctx.platform().wire(), ctx.estimatedValue(), ctx.currentBid(), traceId));

            PipelineState state = engine.start(ctx, traceId);
            if (engine.safetyCheck(state)) {
                return Mono.just(state.finalDecision());
            }

            return Mono.zip(enrich(ctx, traceId), history(ctx, traceId))
                .flatMap(t -> {
                    MarketIntelligence intel = t.getT1().orElse(null);
                    state.intelligence(intel);
                    state.history(t.getT2());
                    return oracle.propose(ctx, intel, t.getT2())
                        .defaultIfEmpty(OracleResult.failure("oracle returned no result"))
                        .onErrorResume(e -> Mono.just(OracleResult.failure(e.getMessage())));
                })
                .map(result -> engine.resolve(state, result));
        })
        .onErrorResume(e -> {
            TraceContextUtil.withMdc(traceId, () ->
                log.error("[AuctionDecision] Unexpected failure, emitting system error. domain={} traceId={} error={}",
                    ctx.domain(), traceId, e.getMessage(), e));
            return Mono.just(FinalDecision.systemError(ctx.domain(), String.valueOf(e.getMessage()), traceId));
        })
        .doOnNext(stats::record);

        return TraceContextUtil.withTrace(pipeline, traceId, ctx.domain());
    }

    private Mono<Optional<MarketIntelligence>> enrich(AuctionContext ctx, String traceId) {
        return Mono.fromCallable(() -> Optional.of(intelligenceResolver.enrich(ctx)))
            .onErrorResume(e -> {
                TraceContextUtil.withMdc(traceId, () ->
                    log.warn("[AuctionDecision] Market intelligence unavailable (non-critical). domain={} reason={}",
                        ctx.domain(), e.getMessage()));
                return Mono.just(Optional.empty());
            });
    }

    private Mono<HistoricalContext> history(AuctionContext ctx, String traceId) {
        return historicalLearning.historicalContext(ctx)
            .defaultIfEmpty(HistoricalContext.empty(ctx.valueTier()))
            .timeout(historyTimeout)
            .onErrorResume(e -> {
                TraceContextUtil.withMdc(traceId, () ->
                    log.warn("[AuctionDecision] Historical context unavailable (non-critical). domain={} reason={}",
                        ctx.domain(), e.getMessage()));
                return Mono.just(HistoricalContext.empty(ctx.valueTier()));
            });
    }

    // ── outcome and round recording ──────────────────────────────────────────

    /** Records a finished auction. The profit margin is derived only for won auctions. */
    public Mono<AuctionOutcome> recordOutcome(OutcomeRequest request) {
        AuctionContext ctx = request.context();
        String auctionId = resolveAuctionId(request);
        AuctionOutcome outcome = AuctionOutcome.of(auctionId, ctx, request.decision(), request.result(),
            request.finalPrice(), request.opponentHash());

        return historyStore.recordOutcome(outcome)
            .thenReturn(outcome)
            .doOnNext(o -> log.info("[AuctionDecision] Outcome recorded. auctionId={} result={} margin={}",
                o.auctionId(), o.result().wire(), o.profitMargin()));
    }

    /**
     * Records the next round of the context's thread. Rounds are numbered from 1 in arrival order.
     * If the store cannot report the next number, nothing is written and the error propagates.
     *
     * @return empty when the context carries no thread id
     */
    public Mono<AuctionRoundRecord> recordRound(RoundRequest request) {
        AuctionContext ctx = request.context();
        if (ctx.threadId() == null || ctx.threadId().isBlank()) {
            log.info("[AuctionDecision] Round not recorded, no thread id. domain={}", ctx.domain());
            return Mono.empty();
        }
        return historyStore.nextRoundNumber(ctx.threadId())
            .map(next -> AuctionRoundRecord.of(ctx, request.decision(), next, request.resultRound()))
            .flatMap(round -> historyStore.recordRound(round).thenReturn(round))
            .doOnNext(r -> log.info("[AuctionDecision] Round recorded. threadId={} round={}",
                r.threadId(), r.roundNumber()))
            .doOnError(e -> log.error("[AuctionDecision] Round not recorded. threadId={} reason={}",
                ctx.threadId(), e.getMessage()));
    }

    public DecisionStats.Snapshot stats() {
        return stats.snapshot();
    }

    public void resetStats() {
        stats.reset();
        log.info("[AuctionDecision] Decision statistics reset");
    }

    static String resolveAuctionId(OutcomeRequest request) {
        if (request.auctionId() != null && !request.auctionId().isBlank()) {
            return request.auctionId();
        }
        AuctionContext ctx = request.context();
        if (ctx.threadId() != null && !ctx.threadId().isBlank()) {
            return ctx.threadId();
        }
        return ctx.domain() + "_" + System.currentTimeMillis();
    }
}
