package com.auctionagent.common.pipeline;

import com.auctionagent.common.history.HistoricalContext;
import com.auctionagent.common.intelligence.MarketIntelligence;
import com.auctionagent.common.model.AuctionContext;
import com.auctionagent.common.model.OracleResult;
import reactor.core.publisher.Mono;

/**
 * External reasoning service that proposes a strategy.
 *
 * <p>Implementations must not signal errors: timeouts, transport failures and malformed
 * output all complete with {@link OracleResult#failure(String)}.
 */
@FunctionalInterface
public interface StrategyOracle {

    Mono<OracleResult> propose(AuctionContext context, MarketIntelligence intelligence,
                               HistoricalContext history);
}
