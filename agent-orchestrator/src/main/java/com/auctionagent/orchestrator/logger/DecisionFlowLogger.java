package com.auctionagent.orchestrator.logger;

import com.auctionagent.common.model.FinalDecision;
import com.auctionagent.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Observability component for the decision lifecycle. Logs each pipeline stage without
 * touching pipeline state. All methods are pure side-effects.
 *
 * <p>Lifecycle stages (in order):
 * <ol>
 *   <li>{@link #SAFETY_CHECKED}         safety gate evaluated</li>
 *   <li>{@link #ORACLE_PROPOSED}        oracle returned a proposal or a failure</li>
 *   <li>{@link #VALIDATED}              proposal passed or failed validation</li>
 *   <li>{@link #FALLBACK_APPLIED}       rule fallback produced the decision</li>
 *   <li>{@link #PROXY_APPLIED}          proxy arithmetic merged into the decision</li>
 *   <li>{@link #FINAL_DECISION_CREATED} final decision assembled</li>
 * </ol>
 */
@Component
public class DecisionFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(DecisionFlowLogger.class);

    public static final String SAFETY_CHECKED         = "SAFETY_CHECKED";
    public static final String ORACLE_PROPOSED        = "ORACLE_PROPOSED";
    public static final String VALIDATED              = "VALIDATED";
    public static final String FALLBACK_APPLIED       = "FALLBACK_APPLIED";
    public static final String PROXY_APPLIED          = "PROXY_APPLIED";
    public static final String FINAL_DECISION_CREATED = "FINAL_DECISION_CREATED";

    /**
     * Logs a lifecycle stage with a short free-form detail.
     *
     * @param stageName one of the stage constants defined in this class
     * @param traceId   bridged into MDC for the duration of the call
     */
    public void stage(String stageName, String traceId, String detail) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[DecisionFlow] stage={} {} traceId={}", stageName, detail, traceId)
        );
    }

    public void finalDecision(FinalDecision decision) {
        TraceContextUtil.withMdc(decision.traceId(), () ->
            log.info("[DecisionFlow] stage={} domain={} strategy={} bid={} source={} confidence={} traceId={}",
                     FINAL_DECISION_CREATED,
                     decision.domain(), decision.strategy().wire(), decision.recommendedBidAmount(),
                     decision.decisionSource().wire(), decision.confidence(), decision.traceId())
        );
    }
}
