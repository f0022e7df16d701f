package com.auctionagent.orchestrator.adapter;

import com.auctionagent.common.history.AuctionOutcome;
import com.auctionagent.common.history.AuctionRoundRecord;
import com.auctionagent.common.history.HistoryStore;
import com.auctionagent.common.history.StrategyPerformance;
import com.auctionagent.common.model.Platform;
import com.auctionagent.common.model.Strategy;
import com.auctionagent.common.model.ValueTier;
import com.auctionagent.common.trace.TraceContextUtil;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * {@link HistoryStore} over the history-service REST API.
 *
 * <p>Lookups feeding the oracle prompt never fail: on any error they log a WARN and complete
 * empty, so that a history-service outage degrades the prompt but never blocks a decision.
 * Writes, and {@link #nextRoundNumber} which numbers them, propagate errors to the caller.
 *
 * <p>The {@code traceId} is taken from the Reactor Context and forwarded as {@code X-Trace-Id}.
 */
@Component
public class HistoryServiceClient implements HistoryStore {

    private static final Logger log = LoggerFactory.getLogger(HistoryServiceClient.class);

    private static final String BASE = "/api/v1/history";

    private final WebClient historyClient;
    private final boolean enabled;

    public HistoryServiceClient(@Qualifier("historyClient") WebClient historyClient,
                                @Value("${history.enabled:true}") boolean enabled) {
        this.historyClient = historyClient;
        this.enabled = enabled;
    }

    @Override
    public Mono<Void> recordOutcome(AuctionOutcome outcome) {
        if (!enabled) return Mono.empty();
        return Mono.deferContextual(ctx -> historyClient.post()
                .uri(BASE + "/outcomes")
                .header("X-Trace-Id", TraceContextUtil.getTraceId(ctx))
                .bodyValue(outcome)
                .retrieve()
                .toBodilessEntity())
            .doOnNext(r -> log.info("[HistoryClient] Outcome recorded. auctionId={} result={}",
                outcome.auctionId(), outcome.result().wire()))
            .then();
    }

    @Override
    public Mono<Void> recordRound(AuctionRoundRecord round) {
        if (!enabled) return Mono.empty();
        return Mono.deferContextual(ctx -> historyClient.post()
                .uri(BASE + "/rounds")
                .header("X-Trace-Id", TraceContextUtil.getTraceId(ctx))
                .bodyValue(round)
                .retrieve()
                .toBodilessEntity())
            .doOnNext(r -> log.info("[HistoryClient] Round recorded. threadId={} round={}",
                round.threadId(), round.roundNumber()))
            .then();
    }

    @Override
    public Flux<AuctionOutcome> getSimilarAuctions(Platform platform, double valueMin, double valueMax, int limit) {
        if (!enabled) return Flux.empty();
        return Flux.deferContextual(ctx -> historyClient.get()
                .uri(uri -> uri.path(BASE + "/outcomes/similar")
                    .queryParam("platform", platform.wire())
                    .queryParam("valueMin", valueMin)
                    .queryParam("valueMax", valueMax)
                    .queryParam("limit", limit)
                    .build())
                .header("X-Trace-Id", TraceContextUtil.getTraceId(ctx))
                .retrieve()
                .bodyToFlux(AuctionOutcome.class)
                .onErrorResume(e -> {
                    log.warn("[HistoryClient] Similar-auction lookup failed, continuing without. domain={} traceId={} reason={}",
                        TraceContextUtil.getDomain(ctx), TraceContextUtil.getTraceId(ctx), e.getMessage());
                    return Flux.empty();
                }));
    }

    @Override
    public Mono<StrategyPerformance> getStrategyPerformance(Strategy strategy, Platform platform, ValueTier valueTier) {
        StrategyPerformance none = StrategyPerformance.empty(strategy, platform, valueTier);
        if (!enabled) return Mono.just(none);
        return Mono.deferContextual(ctx -> historyClient.get()
                .uri(uri -> {
                    uri.path(BASE + "/strategy-performance").queryParam("strategy", strategy.wire());
                    if (platform != null) uri.queryParam("platform", platform.wire());
                    if (valueTier != null) uri.queryParam("valueTier", valueTier.wire());
                    return uri.build();
                })
                .header("X-Trace-Id", TraceContextUtil.getTraceId(ctx))
                .retrieve()
                .bodyToMono(StrategyPerformance.class)
                .defaultIfEmpty(none)
                .onErrorResume(e -> {
                    log.warn("[HistoryClient] Strategy performance lookup failed. strategy={} domain={} traceId={} reason={}",
                        strategy.wire(), TraceContextUtil.getDomain(ctx), TraceContextUtil.getTraceId(ctx),
                        e.getMessage());
                    return Mono.just(none);
                }));
    }

    @Override
    public Mono<Strategy> getBestStrategyForContext(Platform platform, ValueTier valueTier, int minSamples) {
        if (!enabled) return Mono.empty();
        return Mono.deferContextual(ctx -> historyClient.get()
                .uri(uri -> uri.path(BASE + "/best-strategy")
                    .queryParam("platform", platform.wire())
                    .queryParam("valueTier", valueTier.wire())
                    .queryParam("minSamples", minSamples)
                    .build())
                .header("X-Trace-Id", TraceContextUtil.getTraceId(ctx))
                .retrieve()
                .bodyToMono(BestStrategyResponse.class)
                .flatMap(r -> r.strategy() == null ? Mono.<Strategy>empty() : Mono.just(r.strategy()))
                .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.empty())
                .onErrorResume(e -> {
                    log.warn("[HistoryClient] Best-strategy lookup failed. domain={} traceId={} reason={}",
                        TraceContextUtil.getDomain(ctx), TraceContextUtil.getTraceId(ctx), e.getMessage());
                    return Mono.empty();
                }));
    }

    @Override
    public Flux<AuctionRoundRecord> getRoundsForThread(String threadId) {
        if (!enabled || threadId == null || threadId.isBlank()) return Flux.empty();
        return Flux.deferContextual(ctx -> historyClient.get()
                .uri(BASE + "/rounds/{threadId}", Map.of("threadId", threadId))
                .header("X-Trace-Id", TraceContextUtil.getTraceId(ctx))
                .retrieve()
                .bodyToFlux(AuctionRoundRecord.class)
                .onErrorResume(e -> {
                    log.warn("[HistoryClient] Round lookup failed. threadId={} traceId={} reason={}",
                        threadId, TraceContextUtil.getTraceId(ctx), e.getMessage());
                    return Flux.empty();
                }));
    }

    /** Errors propagate, unlike the lookups above. */
    @Override
    public Mono<Integer> nextRoundNumber(String threadId) {
        if (!enabled) return Mono.just(1);
        return Mono.deferContextual(ctx -> historyClient.get()
                .uri(BASE + "/rounds/{threadId}/next-number", Map.of("threadId", threadId))
                .header("X-Trace-Id", TraceContextUtil.getTraceId(ctx))
                .retrieve()
                .bodyToMono(NextRoundResponse.class))
            .map(NextRoundResponse::nextRoundNumber)
            .switchIfEmpty(Mono.error(() ->
                new IllegalStateException("history-service returned no round number for thread " + threadId)));
    }

    /** Body of {@code GET /rounds/{threadId}/next-number}. */
    public record NextRoundResponse(@JsonProperty("next_round_number") int nextRoundNumber) {}

    /** Body of {@code GET /best-strategy}. */
    public record BestStrategyResponse(Strategy strategy) {}
}
