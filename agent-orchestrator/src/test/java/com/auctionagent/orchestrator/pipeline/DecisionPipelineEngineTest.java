package com.auctionagent.orchestrator.pipeline;

import com.auctionagent.common.model.AuctionContext;
import com.auctionagent.common.model.BidderAnalysis;
import com.auctionagent.common.model.DecisionSource;
import com.auctionagent.common.model.FinalDecision;
import com.auctionagent.common.model.OracleResult;
import com.auctionagent.common.model.Platform;
import com.auctionagent.common.model.ProxyAction;
import com.auctionagent.common.model.RiskLevel;
import com.auctionagent.common.model.Strategy;
import com.auctionagent.common.model.StrategyDecision;
import com.auctionagent.common.pipeline.PipelineState;
import com.auctionagent.common.validation.ValidationPolicy;
import com.auctionagent.orchestrator.logger.DecisionFlowLogger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.auctionagent.common.pipeline.PipelineStage.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

class DecisionPipelineEngineTest {

    private static final String REASONING =
        "Profit margin stays healthy at this price; competition is moderate with two bidders, "
        + "risk of overpay is low, so a proxy strategy keeps us in position.";

    private final DecisionPipelineEngine engine =
        new DecisionPipelineEngine(ValidationPolicy.defaults(), new DecisionFlowLogger());

    private static AuctionContext ctx(double value, double currentBid, int bidders, double hours) {
        return new AuctionContext("example.com", Platform.NAMEJET, value, currentBid, bidders, hours, 0.0,
                                  10_000, BidderAnalysis.neutral());
    }

    @Nested
    @DisplayName("safetyCheck()")
    class Safety {

        @Test
        @DisplayName("bid above 130% of value → safety_block, run over")
        void overpaymentBlocks() {
            PipelineState state = engine.start(ctx(1000, 1350, 2, 10), "t-1");

            assertTrue(engine.safetyCheck(state));

            FinalDecision d = state.finalDecision();
            assertEquals(DecisionSource.SAFETY_BLOCK, d.decisionSource());
            assertEquals(Strategy.DO_NOT_BID, d.strategy());
            assertEquals(0.95, d.confidence(), 1e-9);
            assertEquals(RiskLevel.HIGH, d.riskLevel());
            assertEquals("t-1", d.traceId());
            assertEquals(List.of(START, SAFETY_CHECK, BLOCKED, FINALIZE, END), state.visited());
        }

        @Test
        @DisplayName("healthy auction passes without a decision")
        void passes() {
            PipelineState state = engine.start(ctx(800, 100, 2, 10), "t-2");

            assertFalse(engine.safetyCheck(state));
            assertNull(state.finalDecision());
            assertFalse(state.safetyVerdict().blocked());
        }
    }

    @Nested
    @DisplayName("resolve()")
    class Resolve {

        @Test
        @DisplayName("valid oracle proposal is kept with source llm")
        void validProposal() {
            PipelineState state = engine.start(ctx(800, 100, 2, 10), "t-3");
            engine.safetyCheck(state);
            StrategyDecision proposal = StrategyDecision.of(Strategy.PROXY_MAX, 300, 0.7, RiskLevel.MEDIUM, REASONING);

            FinalDecision d = engine.resolve(state, OracleResult.proposal(proposal));

            assertEquals(DecisionSource.LLM, d.decisionSource());
            assertEquals(Strategy.PROXY_MAX, d.strategy());
            assertNull(d.validationMessage());
            assertEquals(ProxyAction.INCREASE_PROXY, d.proxyDecision().proxyAction());
            assertSame(d, state.finalDecision());
            assertEquals(List.of(START, SAFETY_CHECK, ORACLE_PROPOSE, VALIDATE, VALID, PROXY_LOGIC, FINALIZE, END),
                         state.visited());
        }

        @Test
        @DisplayName("oracle failure → rule fallback carrying the failure reason")
        void failedOracle() {
            PipelineState state = engine.start(ctx(1000, 50, 4, 0.5), "t-4");
            engine.safetyCheck(state);

            FinalDecision d = engine.resolve(state, OracleResult.failure("[TIMEOUT] attempt timed out"));

            assertEquals(DecisionSource.RULES_FALLBACK, d.decisionSource());
            assertEquals(Strategy.LAST_MINUTE_SNIPE, d.strategy());
            assertEquals("REJECTED: No oracle proposal: [TIMEOUT] attempt timed out", d.validationMessage());
            assertNotNull(state.fallbackDecision());
            assertEquals(List.of(START, SAFETY_CHECK, ORACLE_PROPOSE, VALIDATE, INVALID, RULE_FALLBACK,
                                 PROXY_LOGIC, FINALIZE, END), state.visited());
        }

        @Test
        @DisplayName("proposal over the value ceiling is rejected and replaced")
        void rejectedProposal() {
            PipelineState state = engine.start(ctx(800, 100, 2, 10), "t-5");
            engine.safetyCheck(state);
            StrategyDecision proposal = StrategyDecision.of(Strategy.PROXY_MAX, 900, 0.7, RiskLevel.MEDIUM, REASONING);

            FinalDecision d = engine.resolve(state, OracleResult.proposal(proposal));

            assertEquals(DecisionSource.RULES_FALLBACK, d.decisionSource());
            assertTrue(d.validationMessage().contains("BID CEILING VIOLATION"));
            assertTrue(d.recommendedBidAmount() <= 800.0);
        }

        @Test
        @DisplayName("exception inside a stage → system_error decision")
        void stageFailure() {
            DecisionFlowLogger failing = mock(DecisionFlowLogger.class);
            doThrow(new IllegalStateException("boom"))
                .when(failing).stage(eq(DecisionFlowLogger.ORACLE_PROPOSED), any(), any());
            DecisionPipelineEngine broken = new DecisionPipelineEngine(ValidationPolicy.defaults(), failing);
            PipelineState state = broken.start(ctx(800, 100, 2, 10), "t-6");
            broken.safetyCheck(state);

            FinalDecision d = broken.resolve(state, OracleResult.failure("x"));

            assertEquals(DecisionSource.SYSTEM_ERROR, d.decisionSource());
            assertEquals(Strategy.DO_NOT_BID, d.strategy());
            assertEquals(0.0, d.confidence(), 1e-9);
            assertTrue(d.reasoning().contains("boom"));
            assertEquals(END, state.visited().get(state.visited().size() - 1));
        }
    }

    @Test
    @DisplayName("finalize without proxy analysis → system_error")
    void finalizeWithoutProxy() {
        PipelineState state = engine.start(ctx(800, 100, 2, 10), "t-7");

        FinalDecision d = engine.finalizeDecision(state);

        assertEquals(DecisionSource.SYSTEM_ERROR, d.decisionSource());
        assertTrue(d.reasoning().contains("proxy analysis missing at finalize"));
    }
}
