package com.auctionagent.history.repository;

import com.auctionagent.history.model.AuctionRoundEntity;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface AuctionRoundRepository extends ReactiveCrudRepository<AuctionRoundEntity, Long> {

    Flux<AuctionRoundEntity> findByThreadIdOrderByRoundNumberAsc(String threadId);

    @Query("SELECT COALESCE(MAX(round_number), 0) + 1 FROM auction_rounds WHERE thread_id = :threadId")
    Mono<Integer> nextRoundNumber(String threadId);

    /**
     * Insert or replace the round keyed by {@code (thread_id, round_number)}.
     */
    @Modifying
    @Query("""
        INSERT INTO auction_rounds
            (thread_id, round_number, domain, platform, estimated_value, current_bid_at_decision,
             strategy_used, recommended_bid, decision_source, confidence, result_round, recorded_at)
        VALUES
            (:threadId, :roundNumber, :domain, :platform, :estimatedValue, :currentBid,
             :strategyUsed, :recommendedBid, :decisionSource, :confidence, :resultRound, :recordedAt)
        ON CONFLICT (thread_id, round_number) DO UPDATE SET
            domain                  = EXCLUDED.domain,
            platform                = EXCLUDED.platform,
            estimated_value         = EXCLUDED.estimated_value,
            current_bid_at_decision = EXCLUDED.current_bid_at_decision,
            strategy_used           = EXCLUDED.strategy_used,
            recommended_bid         = EXCLUDED.recommended_bid,
            decision_source         = EXCLUDED.decision_source,
            confidence              = EXCLUDED.confidence,
            result_round            = EXCLUDED.result_round,
            recorded_at             = EXCLUDED.recorded_at
        """)
    Mono<Void> upsertRound(String threadId, int roundNumber, String domain, String platform,
                           double estimatedValue, double currentBid, String strategyUsed,
                           double recommendedBid, String decisionSource, double confidence,
                           String resultRound, LocalDateTime recordedAt);
}
