package com.auctionagent.common.proxy;

import com.auctionagent.common.model.AuctionContext;
import com.auctionagent.common.model.BidderAnalysis;
import com.auctionagent.common.model.Platform;
import com.auctionagent.common.model.ProxyAction;
import com.auctionagent.common.model.ProxyDecision;
import com.auctionagent.common.model.RiskLevel;
import com.auctionagent.common.model.Strategy;
import com.auctionagent.common.model.StrategyDecision;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProxyLogicEngineTest {

    private static AuctionContext ctx(Platform platform, double value, double bid, double proxy, double budget) {
        return new AuctionContext("example.com", platform, value, bid, 2, 10, proxy, budget,
                                  BidderAnalysis.neutral());
    }

    private static final StrategyDecision PROXY_MAX = StrategyDecision.of(
        Strategy.PROXY_MAX, 700, 0.8, RiskLevel.MEDIUM, "Proxy max keeps us in the auction.");

    @Nested
    @DisplayName("analyze()")
    class Analyze {

        @Test
        @DisplayName("value 800, bid 300, no proxy → initial proxy at 800, next bid 305")
        void initialSetup() {
            ProxyDecision p = ProxyLogicEngine.analyze(ctx(Platform.GODADDY, 800, 300, 0, 5000));
            assertEquals(ProxyAction.INCREASE_PROXY, p.proxyAction());
            assertTrue(p.shouldIncreaseProxy());
            assertEquals(800.0, p.newProxyMax(), 1e-9);
            assertEquals(305.0, p.nextBidAmount(), 1e-9);
            assertEquals(800.0, p.maxBudgetForDomain(), 1e-9);
            assertTrue(p.explanation().startsWith("INITIAL PROXY SETUP"));
        }

        @Test
        @DisplayName("initial proxy is limited by the available budget")
        void budgetLimited() {
            ProxyDecision p = ProxyLogicEngine.analyze(ctx(Platform.GODADDY, 800, 300, 0, 400));
            assertEquals(400.0, p.newProxyMax(), 1e-9);
        }

        @Test
        @DisplayName("dynadot uses 5% of the current bid as increment")
        void dynadotIncrement() {
            ProxyDecision p = ProxyLogicEngine.analyze(ctx(Platform.DYNADOT, 800, 300, 0, 5000));
            assertEquals(315.0, p.nextBidAmount(), 1e-9);
        }

        @Test
        @DisplayName("bid at value → accept loss even without a proxy")
        void acceptLossWithoutProxy() {
            ProxyDecision p = ProxyLogicEngine.analyze(ctx(Platform.GODADDY, 500, 500, 0, 5000));
            assertEquals(ProxyAction.ACCEPT_LOSS, p.proxyAction());
            assertFalse(p.shouldIncreaseProxy());
            assertNull(p.newProxyMax());
            assertNull(p.nextBidAmount());
            assertEquals(0.0, p.maxBudgetForDomain(), 1e-9);
        }

        @Test
        @DisplayName("headroom of three increments or more → raise proxy")
        void raise() {
            ProxyDecision p = ProxyLogicEngine.analyze(ctx(Platform.GODADDY, 800, 600, 700, 5000));
            assertEquals(ProxyAction.INCREASE_PROXY, p.proxyAction());
            assertEquals(800.0, p.newProxyMax(), 1e-9);
            assertEquals(605.0, p.nextBidAmount(), 1e-9);
        }

        @Test
        @DisplayName("less than three increments of headroom → maintain")
        void maintain() {
            ProxyDecision p = ProxyLogicEngine.analyze(ctx(Platform.GODADDY, 800, 600, 790, 5000));
            assertEquals(ProxyAction.MAINTAIN_PROXY, p.proxyAction());
            assertNull(p.newProxyMax());
            assertNull(p.nextBidAmount());
            assertEquals(790.0, p.maxBudgetForDomain(), 1e-9);
        }
    }

    @Nested
    @DisplayName("process()")
    class Process {

        @Test
        @DisplayName("accept loss forces do_not_bid regardless of the input strategy")
        void acceptLossOverride() {
            ProxyLogicEngine.Outcome out = ProxyLogicEngine.process(ctx(Platform.GODADDY, 500, 520, 450, 5000), PROXY_MAX);
            StrategyDecision d = out.decision();
            assertEquals(Strategy.DO_NOT_BID, d.strategy());
            assertEquals(0.0, d.recommendedBidAmount(), 1e-9);
            assertEquals(0.5, d.confidence(), 1e-9);
            assertEquals(RiskLevel.HIGH, d.riskLevel());
            assertEquals(Boolean.FALSE, d.shouldIncreaseProxy());
            assertNull(d.nextBidAmount());
            assertTrue(d.reasoning().contains("PROXY ANALYSIS OVERRIDE"));
        }

        @Test
        @DisplayName("otherwise the strategy is kept and proxy fields are copied")
        void merge() {
            ProxyLogicEngine.Outcome out = ProxyLogicEngine.process(ctx(Platform.GODADDY, 800, 300, 0, 5000), PROXY_MAX);
            StrategyDecision d = out.decision();
            assertEquals(Strategy.PROXY_MAX, d.strategy());
            assertEquals(700.0, d.recommendedBidAmount(), 1e-9);
            assertEquals(Boolean.TRUE, d.shouldIncreaseProxy());
            assertEquals(305.0, d.nextBidAmount(), 1e-9);
            assertEquals(800.0, d.maxBudgetForDomain(), 1e-9);
        }

        @Test
        @DisplayName("do_not_bid without a proxy carries no raise instructions")
        void doNotBidStandsDown() {
            StrategyDecision noBid = StrategyDecision.of(Strategy.DO_NOT_BID, 0, 0.6, RiskLevel.MEDIUM,
                "Too many bidders for the value; sit this one out.");

            ProxyLogicEngine.Outcome out = ProxyLogicEngine.process(ctx(Platform.GODADDY, 800, 300, 0, 5000), noBid);

            assertEquals(ProxyAction.MAINTAIN_PROXY, out.proxy().proxyAction());
            assertFalse(out.proxy().shouldIncreaseProxy());
            assertNull(out.proxy().newProxyMax());
            assertTrue(out.proxy().explanation().startsWith("NO BID"));

            StrategyDecision d = out.decision();
            assertEquals(Strategy.DO_NOT_BID, d.strategy());
            assertEquals(Boolean.FALSE, d.shouldIncreaseProxy());
            assertNull(d.nextBidAmount());
            assertEquals(0.0, d.maxBudgetForDomain(), 1e-9);
            assertEquals(0.6, d.confidence(), 1e-9);
        }
    }
}
