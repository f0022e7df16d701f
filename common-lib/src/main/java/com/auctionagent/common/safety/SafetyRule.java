package com.auctionagent.common.safety;

/** Hard pre-checks run by {@link SafetyGate}, in evaluation order. */
public enum SafetyRule {
    VALUATION_INVALID,
    MINIMUM_BUDGET,
    OVERPAYMENT_PROTECTION,
    PORTFOLIO_CONCENTRATION
}
