package com.auctionagent.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * The single externally observable artifact of one pipeline run.
 *
 * <p>Built exactly once per run through one of the factories below and never mutated.
 */
public record FinalDecision(
    // ── strategy fields ──────────────────────────────────────────────────────
    @JsonProperty("strategy")               Strategy  strategy,
    @JsonProperty("recommended_bid_amount") double    recommendedBidAmount,
    @JsonProperty("confidence")             double    confidence,
    @JsonProperty("risk_level")             RiskLevel riskLevel,
    @JsonProperty("reasoning")              String    reasoning,
    @JsonProperty("should_increase_proxy")  Boolean   shouldIncreaseProxy,
    @JsonProperty("next_bid_amount")        Double    nextBidAmount,
    @JsonProperty("max_budget_for_domain")  double    maxBudgetForDomain,

    // ── provenance ───────────────────────────────────────────────────────────
    @JsonProperty("proxy_decision")         ProxyDecision  proxyDecision,
    @JsonProperty("decision_source")        DecisionSource decisionSource,
    @JsonProperty("validation_message")     String    validationMessage,

    // ── audit ────────────────────────────────────────────────────────────────
    @JsonProperty("domain")                 String    domain,
    @JsonProperty("trace_id")               String    traceId,
    @JsonProperty("decided_at")             Instant   decidedAt
) {
    public static final double SAFETY_BLOCK_CONFIDENCE = 0.95;

    public static FinalDecision from(StrategyDecision decision, ProxyDecision proxy,
                                     DecisionSource source, String validationMessage,
                                     String domain, String traceId) {
        return new FinalDecision(decision.strategy(), decision.recommendedBidAmount(),
                                 decision.confidence(), decision.riskLevel(), decision.reasoning(),
                                 decision.shouldIncreaseProxy(), decision.nextBidAmount(),
                                 decision.maxBudgetForDomain(), proxy, source, validationMessage,
                                 domain, traceId, Instant.now());
    }

    /** Terminal decision for an auction the safety gate refuses to bid on. */
    public static FinalDecision safetyBlock(String domain, String reason, String traceId) {
        return new FinalDecision(Strategy.DO_NOT_BID, 0.0, SAFETY_BLOCK_CONFIDENCE, RiskLevel.HIGH,
                                 reason, false, null, 0.0, null, DecisionSource.SAFETY_BLOCK, null,
                                 domain, traceId, Instant.now());
    }

    /** Fail-safe decision emitted when the pipeline itself breaks. */
    public static FinalDecision systemError(String domain, String error, String traceId) {
        return new FinalDecision(Strategy.DO_NOT_BID, 0.0, 0.0, RiskLevel.HIGH,
                                 "System error: " + error + ". Emergency safe decision: do not bid.",
                                 false, null, 0.0, null, DecisionSource.SYSTEM_ERROR, null,
                                 domain, traceId, Instant.now());
    }

    /** Projection back onto the strategy fields, used when recording outcomes. */
    public StrategyDecision toStrategyDecision() {
        return new StrategyDecision(strategy, recommendedBidAmount, confidence, riskLevel, reasoning,
                                    shouldIncreaseProxy, nextBidAmount, maxBudgetForDomain);
    }
}
