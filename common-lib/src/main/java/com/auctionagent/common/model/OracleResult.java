package com.auctionagent.common.model;

/**
 * Outcome of one oracle consultation: either a proposal or a failure reason, never both.
 */
public record OracleResult(StrategyDecision proposal, String failureReason) {

    public OracleResult {
        if ((proposal == null) == (failureReason == null)) {
            throw new IllegalArgumentException("exactly one of proposal or failureReason must be set");
        }
    }

    public static OracleResult proposal(StrategyDecision decision) {
        return new OracleResult(decision, null);
    }

    public static OracleResult failure(String reason) {
        return new OracleResult(null, reason == null || reason.isBlank() ? "unknown failure" : reason);
    }

    public boolean hasProposal() {
        return proposal != null;
    }
}
