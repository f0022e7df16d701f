package com.auctionagent.orchestrator.pipeline;

import com.auctionagent.common.fallback.RuleFallbackEngine;
import com.auctionagent.common.model.AuctionContext;
import com.auctionagent.common.model.DecisionSource;
import com.auctionagent.common.model.FinalDecision;
import com.auctionagent.common.model.OracleResult;
import com.auctionagent.common.model.StrategyDecision;
import com.auctionagent.common.model.ValidationResult;
import com.auctionagent.common.pipeline.PipelineStage;
import com.auctionagent.common.pipeline.PipelineState;
import com.auctionagent.common.proxy.ProxyLogicEngine;
import com.auctionagent.common.safety.SafetyGate;
import com.auctionagent.common.validation.StrategyValidator;
import com.auctionagent.common.validation.ValidationPolicy;
import com.auctionagent.orchestrator.logger.DecisionFlowLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Synchronous half of the decision state machine. {@code AuctionDecisionService} owns the I/O
 * (enrichment, history, oracle) and hands each result to this engine.
 *
 * <h3>Stage order</h3>
 * <pre>
 * START → SAFETY_CHECK → BLOCKED → FINALIZE → END
 *                      → ORACLE_PROPOSE → VALIDATE → VALID ─────────────────→ PROXY_LOGIC → FINALIZE → END
 *                                                  → INVALID → RULE_FALLBACK ↗
 * </pre>
 *
 * <p>Every path ends with exactly one {@link FinalDecision} on the state. Any exception after
 * the safety gate is converted into a {@code system_error} decision.
 */
@Component
public class DecisionPipelineEngine {

    private static final Logger log = LoggerFactory.getLogger(DecisionPipelineEngine.class);

    static final String NO_PROPOSAL_PREFIX = "No oracle proposal: ";

    private final ValidationPolicy policy;
    private final DecisionFlowLogger flowLogger;

    public DecisionPipelineEngine(ValidationPolicy policy, DecisionFlowLogger flowLogger) {
        this.policy = policy;
        this.flowLogger = flowLogger;
    }

    public PipelineState start(AuctionContext ctx, String traceId) {
        return new PipelineState(ctx, traceId);
    }

    /**
     * Runs the safety gate. On a block the state is finalized with a {@code safety_block} decision.
     *
     * @return {@code true} when the run is over
     */
    public boolean safetyCheck(PipelineState state) {
        state.visit(PipelineStage.SAFETY_CHECK);
        SafetyGate.Verdict verdict = SafetyGate.evaluate(state.context());
        state.safetyVerdict(verdict);
        flowLogger.stage(DecisionFlowLogger.SAFETY_CHECKED, state.traceId(),
            "blocked=" + verdict.blocked() + " rule=" + verdict.rule());

        if (!verdict.blocked()) {
            return false;
        }
        state.visit(PipelineStage.BLOCKED);
        state.visit(PipelineStage.FINALIZE);
        FinalDecision decision = FinalDecision.safetyBlock(state.context().domain(), verdict.reason(), state.traceId());
        state.finalDecision(decision);
        state.visit(PipelineStage.END);
        flowLogger.finalDecision(decision);
        return true;
    }

    /**
     * Validates the oracle's answer, falls back to rules when it is missing or rejected,
     * applies proxy arithmetic and finalizes.
     */
    public FinalDecision resolve(PipelineState state, OracleResult oracle) {
        try {
            state.visit(PipelineStage.ORACLE_PROPOSE);
            state.oracleResult(oracle);
            flowLogger.stage(DecisionFlowLogger.ORACLE_PROPOSED, state.traceId(),
                oracle.hasProposal() ? "proposal=" + oracle.proposal().strategy().wire()
                                     : "failure=" + oracle.failureReason());

            state.visit(PipelineStage.VALIDATE);
            ValidationResult validation = oracle.hasProposal()
                ? StrategyValidator.validate(oracle.proposal(), state.context(), policy)
                : ValidationResult.rejected(NO_PROPOSAL_PREFIX + oracle.failureReason());
            state.validation(validation);
            flowLogger.stage(DecisionFlowLogger.VALIDATED, state.traceId(),
                "valid=" + validation.isValid() + " warnings=" + validation.warnings().size());

            if (validation.isValid()) {
                state.visit(PipelineStage.VALID);
                state.chosenDecision(oracle.proposal(), DecisionSource.LLM);
            } else {
                state.visit(PipelineStage.INVALID);
                state.visit(PipelineStage.RULE_FALLBACK);
                StrategyDecision fallback = RuleFallbackEngine.decide(state.context(), state.intelligence());
                state.fallbackDecision(fallback);
                state.chosenDecision(fallback, DecisionSource.RULES_FALLBACK);
                flowLogger.stage(DecisionFlowLogger.FALLBACK_APPLIED, state.traceId(),
                    "strategy=" + fallback.strategy().wire() + " reason=" + validation.message());
            }

            state.visit(PipelineStage.PROXY_LOGIC);
            ProxyLogicEngine.Outcome proxied = ProxyLogicEngine.process(state.context(), state.chosenDecision());
            state.proxyDecision(proxied.proxy());
            state.chosenDecision(proxied.decision(), state.decisionSource());
            flowLogger.stage(DecisionFlowLogger.PROXY_APPLIED, state.traceId(),
                "action=" + proxied.proxy().proxyAction().wire());

            return finalizeDecision(state);
        } catch (RuntimeException e) {
            log.error("[DecisionPipeline] Pipeline failure, emitting system error. domain={} traceId={} error={}",
                state.context().domain(), state.traceId(), e.getMessage(), e);
            FinalDecision decision = FinalDecision.systemError(state.context().domain(), e.getMessage(), state.traceId());
            state.finalDecision(decision);
            state.visit(PipelineStage.END);
            flowLogger.finalDecision(decision);
            return decision;
        }
    }

    FinalDecision finalizeDecision(PipelineState state) {
        state.visit(PipelineStage.FINALIZE);
        FinalDecision decision;
        if (state.proxyDecision() == null || state.chosenDecision() == null) {
            decision = FinalDecision.systemError(state.context().domain(),
                "proxy analysis missing at finalize", state.traceId());
        } else {
            String message = state.validation() == null ? "" : state.validation().message();
            decision = FinalDecision.from(state.chosenDecision(), state.proxyDecision(), state.decisionSource(),
                message.isEmpty() ? null : message, state.context().domain(), state.traceId());
        }
        state.finalDecision(decision);
        state.visit(PipelineStage.END);
        flowLogger.finalDecision(decision);
        return decision;
    }
}
