package com.auctionagent.history.repository;

import com.auctionagent.history.model.StrategyPerformanceEntity;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface StrategyPerformanceRepository extends ReactiveCrudRepository<StrategyPerformanceEntity, Long> {

    Flux<StrategyPerformanceEntity> findByStrategy(String strategy);

    /**
     * Rebuilds one aggregate row from {@code auction_outcomes}. Recomputing instead of
     * incrementing keeps the row correct when an outcome is recorded more than once.
     */
    @Modifying
    @Query("""
        INSERT INTO strategy_performance
            (strategy, platform, value_tier, total_uses, wins, total_profit,
             win_rate, avg_profit_per_win, last_updated)
        SELECT :strategy, :platform, :valueTier,
               agg.total_uses, agg.wins, agg.total_profit,
               CASE WHEN agg.total_uses > 0 THEN CAST(agg.wins AS DOUBLE PRECISION) / agg.total_uses ELSE 0.0 END,
               CASE WHEN agg.wins > 0 THEN agg.total_profit / agg.wins ELSE 0.0 END,
               NOW()
        FROM (
            SELECT COUNT(*) AS total_uses,
                   COUNT(*) FILTER (WHERE result = 'won') AS wins,
                   COALESCE(SUM(CASE WHEN result = 'won'
                                     THEN COALESCE(profit_margin, 0) * COALESCE(final_price, 0)
                                     ELSE 0 END), 0.0) AS total_profit
            FROM auction_outcomes
            WHERE strategy_used = :strategy
              AND platform = :platform
              AND value_tier = :valueTier
        ) agg
        ON CONFLICT (strategy, platform, value_tier) DO UPDATE SET
            total_uses         = EXCLUDED.total_uses,
            wins               = EXCLUDED.wins,
            total_profit       = EXCLUDED.total_profit,
            win_rate           = EXCLUDED.win_rate,
            avg_profit_per_win = EXCLUDED.avg_profit_per_win,
            last_updated       = NOW()
        """)
    Mono<Void> recompute(String strategy, String platform, String valueTier);

    @Query("""
        SELECT * FROM strategy_performance
        WHERE platform = :platform
          AND value_tier = :valueTier
          AND total_uses >= :minSamples
        ORDER BY win_rate DESC, total_uses DESC
        LIMIT 1
        """)
    Mono<StrategyPerformanceEntity> findBest(String platform, String valueTier, int minSamples);
}
