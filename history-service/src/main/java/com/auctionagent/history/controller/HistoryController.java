package com.auctionagent.history.controller;

import com.auctionagent.common.history.AuctionOutcome;
import com.auctionagent.common.history.AuctionRoundRecord;
import com.auctionagent.common.history.StrategyPerformance;
import com.auctionagent.common.model.Platform;
import com.auctionagent.common.model.Strategy;
import com.auctionagent.common.model.ValueTier;
import com.auctionagent.history.service.AuctionHistoryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.function.Function;

/**
 * Enum-valued query parameters take the lower-case wire names, e.g. {@code platform=godaddy}.
 */
@RestController
@RequestMapping("/api/v1/history")
public class HistoryController {

    private static final Logger log = LoggerFactory.getLogger(HistoryController.class);

    private final AuctionHistoryService historyService;

    public HistoryController(AuctionHistoryService historyService) {
        this.historyService = historyService;
    }

    @PostMapping("/outcomes")
    public Mono<ResponseEntity<Void>> recordOutcome(
            @RequestBody AuctionOutcome outcome,
            @RequestHeader(value = "X-Trace-Id", required = false) String traceId) {
        log.info("Received outcome. auctionId={} domain={} traceId={}", outcome.auctionId(), outcome.domain(), traceId);
        return historyService.recordOutcome(outcome)
            .then(Mono.just(ResponseEntity.ok().<Void>build()))
            .doOnError(e -> log.error("Outcome endpoint error. auctionId={} traceId={}", outcome.auctionId(), traceId, e));
    }

    @PostMapping("/rounds")
    public Mono<ResponseEntity<Void>> recordRound(
            @RequestBody AuctionRoundRecord round,
            @RequestHeader(value = "X-Trace-Id", required = false) String traceId) {
        log.info("Received round. threadId={} round={} traceId={}", round.threadId(), round.roundNumber(), traceId);
        return historyService.recordRound(round)
            .then(Mono.just(ResponseEntity.ok().<Void>build()))
            .doOnError(e -> log.error("Round endpoint error. threadId={} traceId={}", round.threadId(), traceId, e));
    }

    @GetMapping("/outcomes/similar")
    public Flux<AuctionOutcome> similarAuctions(@RequestParam String platform,
                                                @RequestParam double valueMin,
                                                @RequestParam double valueMax,
                                                @RequestParam(defaultValue = "10") int limit) {
        return historyService.getSimilarAuctions(parse(platform, Platform::fromWire), valueMin, valueMax, limit);
    }

    @GetMapping("/strategy-performance")
    public Mono<ResponseEntity<StrategyPerformance>> strategyPerformance(
            @RequestParam String strategy,
            @RequestParam(required = false) String platform,
            @RequestParam(required = false) String valueTier) {
        return historyService.getStrategyPerformance(
                parse(strategy, Strategy::fromWire),
                platform == null ? null : parse(platform, Platform::fromWire),
                valueTier == null ? null : parse(valueTier, ValueTier::fromWire))
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Strategy performance endpoint error. strategy={}", strategy, e));
    }

    /** 404 when no strategy has enough samples. */
    @GetMapping("/best-strategy")
    public Mono<ResponseEntity<Map<String, String>>> bestStrategy(
            @RequestParam String platform,
            @RequestParam String valueTier,
            @RequestParam(defaultValue = "5") int minSamples) {
        return historyService.getBestStrategyForContext(
                parse(platform, Platform::fromWire), parse(valueTier, ValueTier::fromWire), minSamples)
            .map(s -> ResponseEntity.ok(Map.of("strategy", s.wire())))
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/rounds/{threadId}")
    public Flux<AuctionRoundRecord> rounds(@PathVariable String threadId) {
        return historyService.getRoundsForThread(threadId);
    }

    @GetMapping("/rounds/{threadId}/next-number")
    public Mono<Map<String, Integer>> nextRoundNumber(@PathVariable String threadId) {
        return historyService.nextRoundNumber(threadId)
            .map(n -> Map.of("next_round_number", n))
            .doOnError(e -> log.error("Next round number endpoint error. threadId={}", threadId, e));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    private static <T> T parse(String value, Function<String, T> parser) {
        try {
            return parser.apply(value);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }
}
