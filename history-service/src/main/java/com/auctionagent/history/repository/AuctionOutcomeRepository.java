package com.auctionagent.history.repository;

import com.auctionagent.history.model.AuctionOutcomeEntity;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface AuctionOutcomeRepository extends ReactiveCrudRepository<AuctionOutcomeEntity, String> {

    /**
     * Insert or replace the outcome keyed by {@code auction_id}.
     */
    @Modifying
    @Query("""
        INSERT INTO auction_outcomes
            (auction_id, domain, platform, recorded_at, estimated_value, current_bid_at_decision,
             final_price, num_bidders, hours_remaining_at_decision, bot_detected, strategy_used,
             recommended_bid, decision_source, confidence, result, profit_margin, opponent_hash,
             value_tier)
        VALUES
            (:auctionId, :domain, :platform, :recordedAt, :estimatedValue, :currentBid,
             :finalPrice, :numBidders, :hoursRemaining, :botDetected, :strategyUsed,
             :recommendedBid, :decisionSource, :confidence, :result, :profitMargin, :opponentHash,
             :valueTier)
        ON CONFLICT (auction_id) DO UPDATE SET
            domain                      = EXCLUDED.domain,
            platform                    = EXCLUDED.platform,
            recorded_at                 = EXCLUDED.recorded_at,
            estimated_value             = EXCLUDED.estimated_value,
            current_bid_at_decision     = EXCLUDED.current_bid_at_decision,
            final_price                 = EXCLUDED.final_price,
            num_bidders                 = EXCLUDED.num_bidders,
            hours_remaining_at_decision = EXCLUDED.hours_remaining_at_decision,
            bot_detected                = EXCLUDED.bot_detected,
            strategy_used               = EXCLUDED.strategy_used,
            recommended_bid             = EXCLUDED.recommended_bid,
            decision_source             = EXCLUDED.decision_source,
            confidence                  = EXCLUDED.confidence,
            result                      = EXCLUDED.result,
            profit_margin               = EXCLUDED.profit_margin,
            opponent_hash               = EXCLUDED.opponent_hash,
            value_tier                  = EXCLUDED.value_tier
        """)
    Mono<Void> upsertOutcome(String auctionId, String domain, String platform, LocalDateTime recordedAt,
                             double estimatedValue, double currentBid, Double finalPrice, int numBidders,
                             double hoursRemaining, boolean botDetected, String strategyUsed,
                             double recommendedBid, String decisionSource, double confidence,
                             String result, Double profitMargin, String opponentHash, String valueTier);

    @Query("""
        SELECT * FROM auction_outcomes
        WHERE platform = :platform
          AND estimated_value BETWEEN :valueMin AND :valueMax
        ORDER BY recorded_at DESC
        LIMIT :limit
        """)
    Flux<AuctionOutcomeEntity> findSimilar(String platform, double valueMin, double valueMax, int limit);
}
