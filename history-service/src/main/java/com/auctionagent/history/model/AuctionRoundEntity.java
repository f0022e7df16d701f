package com.auctionagent.history.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/** One decision round of a multi-round auction; unique on {@code (thread_id, round_number)}. */
@Data
@NoArgsConstructor
@Table("auction_rounds")
public class AuctionRoundEntity {

    @Id
    private Long id;

    private String threadId;

    private int roundNumber;

    private String domain;

    private String platform;

    private double estimatedValue;

    private double currentBidAtDecision;

    private String strategyUsed;

    private double recommendedBid;

    private String decisionSource;

    private double confidence;

    private String resultRound;

    private LocalDateTime recordedAt;
}
