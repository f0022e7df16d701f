package com.auctionagent.orchestrator.service;

import com.auctionagent.common.model.FinalDecision;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/** Process-wide counters of decisions by source. */
@Component
public class DecisionStats {

    private final AtomicLong total         = new AtomicLong();
    private final AtomicLong llmSuccess    = new AtomicLong();
    private final AtomicLong rulesFallback = new AtomicLong();
    private final AtomicLong safetyBlock   = new AtomicLong();
    private final AtomicLong systemError   = new AtomicLong();

    public void record(FinalDecision decision) {
        total.incrementAndGet();
        switch (decision.decisionSource()) {
            case LLM            -> llmSuccess.incrementAndGet();
            case RULES_FALLBACK -> rulesFallback.incrementAndGet();
            case SAFETY_BLOCK   -> safetyBlock.incrementAndGet();
            case SYSTEM_ERROR   -> systemError.incrementAndGet();
        }
    }

    public Snapshot snapshot() {
        return Snapshot.of(total.get(), llmSuccess.get(), rulesFallback.get(),
                           safetyBlock.get(), systemError.get());
    }

    public void reset() {
        total.set(0);
        llmSuccess.set(0);
        rulesFallback.set(0);
        safetyBlock.set(0);
        systemError.set(0);
    }

    /** Rates are fractions of {@code totalDecisions}, 0 when nothing was decided yet. */
    public record Snapshot(
        @JsonProperty("total_decisions")     long   totalDecisions,
        @JsonProperty("llm_success")         long   llmSuccess,
        @JsonProperty("rules_fallback")      long   rulesFallback,
        @JsonProperty("safety_block")        long   safetyBlock,
        @JsonProperty("system_error")        long   systemError,
        @JsonProperty("llm_success_rate")    double llmSuccessRate,
        @JsonProperty("fallback_rate")       double fallbackRate,
        @JsonProperty("safety_block_rate")   double safetyBlockRate,
        @JsonProperty("system_error_rate")   double systemErrorRate
    ) {
        static Snapshot of(long total, long llm, long fallback, long safety, long error) {
            return new Snapshot(total, llm, fallback, safety, error,
                rate(llm, total), rate(fallback, total), rate(safety, total), rate(error, total));
        }

        private static double rate(long count, long total) {
            return total == 0 ? 0.0 : (double) count / total;
        }
    }
}
