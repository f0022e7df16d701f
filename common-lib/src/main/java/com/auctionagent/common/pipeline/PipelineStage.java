package com.auctionagent.common.pipeline;

/** States of the decision graph, in the order a run can visit them. */
public enum PipelineStage {
    START,
    SAFETY_CHECK,
    BLOCKED,
    ORACLE_PROPOSE,
    VALIDATE,
    VALID,
    INVALID,
    RULE_FALLBACK,
    PROXY_LOGIC,
    FINALIZE,
    END
}
