package com.auctionagent.common.intelligence;

/** ROI band of an expected-value analysis. */
public enum BidRecommendation {
    STRONG_BID,
    MODERATE_BID,
    WEAK_BID
}
