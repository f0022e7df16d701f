package com.auctionagent.history.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Per {@code (strategy, platform, value_tier)} aggregate, recomputed from
 * {@code auction_outcomes} whenever an outcome in that group is written.
 */
@Data
@NoArgsConstructor
@Table("strategy_performance")
public class StrategyPerformanceEntity {

    @Id
    private Long id;

    private String strategy;

    private String platform;

    private String valueTier;

    private long totalUses;

    private long wins;

    private double totalProfit;

    private double winRate;

    private double avgProfitPerWin;

    private LocalDateTime lastUpdated;
}
