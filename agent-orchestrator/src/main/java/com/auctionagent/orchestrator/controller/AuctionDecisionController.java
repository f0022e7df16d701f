package com.auctionagent.orchestrator.controller;

import com.auctionagent.common.history.AuctionOutcome;
import com.auctionagent.common.history.AuctionRoundRecord;
import com.auctionagent.common.model.AuctionContext;
import com.auctionagent.common.model.FinalDecision;
import com.auctionagent.common.trace.TraceContextUtil;
import com.auctionagent.orchestrator.model.OutcomeRequest;
import com.auctionagent.orchestrator.model.RoundRequest;
import com.auctionagent.orchestrator.service.AuctionDecisionService;
import com.auctionagent.orchestrator.service.DecisionStats;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/auction")
public class AuctionDecisionController {

    private final AuctionDecisionService decisionService;

    public AuctionDecisionController(AuctionDecisionService decisionService) {
        this.decisionService = decisionService;
    }

    @PostMapping("/decide")
    public Mono<ResponseEntity<FinalDecision>> decide(
            @RequestBody AuctionContext context,
            @RequestHeader(value = "X-Trace-Id", required = false) String traceId) {
        String effectiveTraceId = traceId == null || traceId.isBlank() ? TraceContextUtil.newTraceId() : traceId;
        return decisionService.decide(context, effectiveTraceId).map(ResponseEntity::ok);
    }

    @PostMapping("/outcome")
    public Mono<ResponseEntity<AuctionOutcome>> recordOutcome(@RequestBody OutcomeRequest request) {
        return decisionService.recordOutcome(request).map(ResponseEntity::ok);
    }

    /** 204 when the context has no thread id and nothing was recorded. */
    @PostMapping("/round")
    public Mono<ResponseEntity<AuctionRoundRecord>> recordRound(@RequestBody RoundRequest request) {
        return decisionService.recordRound(request)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.noContent().build());
    }

    @GetMapping("/stats")
    public ResponseEntity<DecisionStats.Snapshot> stats() {
        return ResponseEntity.ok(decisionService.stats());
    }

    @DeleteMapping("/stats")
    public ResponseEntity<Void> resetStats() {
        decisionService.resetStats();
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
