package com.auctionagent.history.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * One finished auction. Enum-valued columns hold the lower-case wire names.
 *
 * <p>{@code valueTier} is derived from {@code estimatedValue} at write time so that
 * strategy aggregates can group on it without recomputing tiers in SQL.
 */
@Data
@NoArgsConstructor
@Table("auction_outcomes")
public class AuctionOutcomeEntity {

    @Id
    private String auctionId;

    private String domain;

    private String platform;

    private LocalDateTime recordedAt;

    private double estimatedValue;

    private double currentBidAtDecision;

    private Double finalPrice;

    private int numBidders;

    private double hoursRemainingAtDecision;

    private boolean botDetected;

    private String strategyUsed;

    private double recommendedBid;

    private String decisionSource;

    private double confidence;

    private String result;

    private Double profitMargin;

    private String opponentHash;

    private String valueTier;
}
