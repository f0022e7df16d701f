package com.auctionagent.common.fallback;

import com.auctionagent.common.intelligence.BidderIntelligence;
import com.auctionagent.common.intelligence.BidderProfile;
import com.auctionagent.common.intelligence.MarketIntelligence;
import com.auctionagent.common.model.AuctionContext;
import com.auctionagent.common.model.BidderAnalysis;
import com.auctionagent.common.model.Platform;
import com.auctionagent.common.model.RiskLevel;
import com.auctionagent.common.model.Strategy;
import com.auctionagent.common.model.StrategyDecision;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RuleFallbackEngineTest {

    private static AuctionContext ctx(Platform platform, double value, int bidders, double hours, boolean bot) {
        return new AuctionContext("example.com", platform, value, 50, bidders, hours, 0.0, 10_000,
                                  new BidderAnalysis(bot, false, bot ? 8.0 : 5.0, 30.0));
    }

    @Nested
    @DisplayName("high tier (≥ $1000)")
    class HighTier {

        @Test
        @DisplayName("value 1000, 4 bidders, 0.5h → snipe at 0.70 with high risk")
        void crowdedHighValue() {
            StrategyDecision d = RuleFallbackEngine.decide(ctx(Platform.NAMEJET, 1000, 4, 0.5, false), null);
            assertEquals(Strategy.LAST_MINUTE_SNIPE, d.strategy());
            assertEquals(1000.0, d.recommendedBidAmount(), 1e-9);
            assertEquals(0.70, d.confidence(), 1e-9);
            assertEquals(RiskLevel.HIGH, d.riskLevel());
            assertEquals(1000.0, d.maxBudgetForDomain(), 1e-9);
            assertTrue(d.reasoning().startsWith("HIGH-VALUE COMPETITION"));
        }

        @Test
        @DisplayName("no bidders and under an hour → wait for closeout")
        void closeout() {
            StrategyDecision d = RuleFallbackEngine.decide(ctx(Platform.NAMEJET, 2000, 0, 0.5, false), null);
            assertEquals(Strategy.WAIT_FOR_CLOSEOUT, d.strategy());
            assertEquals(0.85, d.confidence(), 1e-9);
            assertEquals(RiskLevel.LOW, d.riskLevel());
        }

        @Test
        @DisplayName("bot detected → snipe at 0.80")
        void botCounter() {
            StrategyDecision d = RuleFallbackEngine.decide(ctx(Platform.NAMEJET, 2000, 3, 10, true), null);
            assertEquals(Strategy.LAST_MINUTE_SNIPE, d.strategy());
            assertEquals(0.80, d.confidence(), 1e-9);
            assertEquals(RiskLevel.MEDIUM, d.riskLevel());
        }

        @Test
        @DisplayName("two bidders → proxy max")
        void fewBidders() {
            StrategyDecision d = RuleFallbackEngine.decide(ctx(Platform.NAMEJET, 2000, 2, 10, false), null);
            assertEquals(Strategy.PROXY_MAX, d.strategy());
            assertEquals(0.75, d.confidence(), 1e-9);
        }
    }

    @Nested
    @DisplayName("medium tier ($100 – $999)")
    class MediumTier {

        @Test
        @DisplayName("extension platform inside the last hour → snipe")
        void extensionTiming() {
            StrategyDecision d = RuleFallbackEngine.decide(ctx(Platform.GODADDY, 500, 2, 0.5, false), null);
            assertEquals(Strategy.LAST_MINUTE_SNIPE, d.strategy());
            assertEquals(0.80, d.confidence(), 1e-9);
        }

        @Test
        @DisplayName("no extension rule, same timing → proxy max")
        void noExtension() {
            StrategyDecision d = RuleFallbackEngine.decide(ctx(Platform.NAMEJET, 500, 2, 0.5, false), null);
            assertEquals(Strategy.PROXY_MAX, d.strategy());
        }

        @Test
        @DisplayName("more than five bidders → incremental test at half the safe max")
        void crowd() {
            StrategyDecision d = RuleFallbackEngine.decide(ctx(Platform.NAMEJET, 500, 6, 10, false), null);
            assertEquals(Strategy.INCREMENTAL_TEST, d.strategy());
            assertEquals(250.0, d.recommendedBidAmount(), 1e-9);
            assertEquals(500.0, d.maxBudgetForDomain(), 1e-9);
            assertEquals(0.65, d.confidence(), 1e-9);
        }
    }

    @Nested
    @DisplayName("low tier (< $100)")
    class LowTier {

        @Test
        @DisplayName("no bidders → wait for closeout at 0.90")
        void closeout() {
            StrategyDecision d = RuleFallbackEngine.decide(ctx(Platform.NAMEJET, 80, 0, 10, false), null);
            assertEquals(Strategy.WAIT_FOR_CLOSEOUT, d.strategy());
            assertEquals(0.90, d.confidence(), 1e-9);
        }

        @Test
        @DisplayName("with bidders → incremental bid capped at $50")
        void incremental() {
            StrategyDecision d = RuleFallbackEngine.decide(ctx(Platform.NAMEJET, 80, 2, 10, false), null);
            assertEquals(Strategy.INCREMENTAL_TEST, d.strategy());
            assertEquals(50.0, d.recommendedBidAmount(), 1e-9);
        }
    }

    @Test
    @DisplayName("aggressive known opponent discounts the safe max by 5%")
    void aggressiveOpponent() {
        BidderProfile aggressive = new BidderProfile("b1", 20, 100, 80.0, 5000, 0.5, 0.2, 10, 0.1);
        MarketIntelligence intel = new MarketIntelligence(BidderIntelligence.from(aggressive),
            null, null, null, null, null, null);
        StrategyDecision d = RuleFallbackEngine.decide(ctx(Platform.NAMEJET, 2000, 2, 10, false), intel);
        assertEquals(1900.0, d.recommendedBidAmount(), 1e-9);
    }

    @Test
    @DisplayName("same input, same output")
    void deterministic() {
        AuctionContext c = ctx(Platform.NAMEJET, 1000, 4, 0.5, false);
        assertEquals(RuleFallbackEngine.decide(c, null), RuleFallbackEngine.decide(c, null));
    }
}
