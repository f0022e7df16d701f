package com.auctionagent.orchestrator.service;

import com.auctionagent.common.history.AuctionOutcome;
import com.auctionagent.common.history.HistoricalContext;
import com.auctionagent.common.history.HistoricalLearning;
import com.auctionagent.common.history.HistoryStore;
import com.auctionagent.common.intelligence.MarketIntelligenceResolver;
import com.auctionagent.common.intelligence.MarketIntelligenceSource;
import com.auctionagent.common.model.AuctionContext;
import com.auctionagent.common.model.AuctionResult;
import com.auctionagent.common.model.BidderAnalysis;
import com.auctionagent.common.model.DecisionSource;
import com.auctionagent.common.model.FinalDecision;
import com.auctionagent.common.model.OracleResult;
import com.auctionagent.common.model.Platform;
import com.auctionagent.common.model.RiskLevel;
import com.auctionagent.common.model.Strategy;
import com.auctionagent.common.model.StrategyDecision;
import com.auctionagent.common.pipeline.StrategyOracle;
import com.auctionagent.common.validation.ValidationPolicy;
import com.auctionagent.orchestrator.adapter.HistoryServiceClient;
import com.auctionagent.orchestrator.logger.DecisionFlowLogger;
import com.auctionagent.orchestrator.model.OutcomeRequest;
import com.auctionagent.orchestrator.model.RoundRequest;
import com.auctionagent.orchestrator.pipeline.DecisionPipelineEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AuctionDecisionServiceTest {

    private static final String REASONING =
        "Profit margin stays healthy at this price; competition is moderate with two bidders, "
        + "risk of overpay is low, so a proxy strategy keeps us in position.";

    @Mock
    private HistoricalLearning historicalLearning;

    @Mock
    private StrategyOracle oracle;

    @Mock
    private HistoryStore historyStore;

    private DecisionStats stats;
    private AuctionDecisionService service;

    @BeforeEach
    void setUp() {
        stats = new DecisionStats();
        service = newService(new MarketIntelligenceResolver(MarketIntelligenceSource.empty()));
    }

    private AuctionDecisionService newService(MarketIntelligenceResolver resolver) {
        return newService(resolver, historyStore, 3000);
    }

    private AuctionDecisionService newService(MarketIntelligenceResolver resolver, HistoryStore store, long historyTimeoutMs) {
        DecisionPipelineEngine engine = new DecisionPipelineEngine(ValidationPolicy.defaults(), new DecisionFlowLogger());
        return new AuctionDecisionService(engine, resolver, historicalLearning, oracle, store, stats, historyTimeoutMs);
    }

    private static AuctionContext ctx(double value, double currentBid, int bidders, double hours, String threadId) {
        return new AuctionContext("example.com", Platform.NAMEJET, value, currentBid, bidders, hours, 0.0,
                                  10_000, BidderAnalysis.neutral(), threadId, null);
    }

    private void noHistory() {
        when(historicalLearning.historicalContext(any()))
            .thenAnswer(inv -> Mono.just(HistoricalContext.empty(inv.<AuctionContext>getArgument(0).valueTier())));
    }

    @Nested
    @DisplayName("decide()")
    class Decide {

        @Test
        @DisplayName("safety block skips enrichment, history and the oracle")
        void safetyBlock() {
            StepVerifier.create(service.decide(ctx(1000, 1350, 2, 10, null), "trace-1"))
                .assertNext(d -> {
                    assertEquals(DecisionSource.SAFETY_BLOCK, d.decisionSource());
                    assertEquals(Strategy.DO_NOT_BID, d.strategy());
                    assertEquals(0.95, d.confidence(), 1e-9);
                    assertEquals("trace-1", d.traceId());
                })
                .verifyComplete();

            verifyNoInteractions(oracle, historicalLearning);
            assertEquals(1, stats.snapshot().safetyBlock());
        }

        @Test
        @DisplayName("valid proposal → llm decision")
        void llmDecision() {
            noHistory();
            when(oracle.propose(any(), any(), any())).thenReturn(Mono.just(OracleResult.proposal(
                StrategyDecision.of(Strategy.PROXY_MAX, 300, 0.7, RiskLevel.MEDIUM, REASONING))));

            StepVerifier.create(service.decide(ctx(800, 100, 2, 10, null), "trace-2"))
                .assertNext(d -> {
                    assertEquals(DecisionSource.LLM, d.decisionSource());
                    assertEquals(Strategy.PROXY_MAX, d.strategy());
                    assertNotNull(d.proxyDecision());
                })
                .verifyComplete();
            assertEquals(1, stats.snapshot().llmSuccess());
        }

        @Test
        @DisplayName("oracle failure → deterministic rule fallback")
        void oracleFailure() {
            noHistory();
            when(oracle.propose(any(), any(), any()))
                .thenReturn(Mono.just(OracleResult.failure("oracle not configured: no API key")));

            StepVerifier.create(service.decide(ctx(1000, 50, 4, 0.5, null), "trace-3"))
                .assertNext(d -> {
                    assertEquals(DecisionSource.RULES_FALLBACK, d.decisionSource());
                    assertEquals(Strategy.LAST_MINUTE_SNIPE, d.strategy());
                    assertEquals(0.70, d.confidence(), 1e-9);
                    assertTrue(d.validationMessage().contains("oracle not configured"));
                })
                .verifyComplete();
            assertEquals(1, stats.snapshot().rulesFallback());
        }

        @Test
        @DisplayName("oracle signalling an error still yields a fallback decision")
        void oracleError() {
            noHistory();
            when(oracle.propose(any(), any(), any())).thenReturn(Mono.error(new IllegalStateException("socket closed")));

            StepVerifier.create(service.decide(ctx(1000, 50, 4, 0.5, null), "trace-4"))
                .assertNext(d -> {
                    assertEquals(DecisionSource.RULES_FALLBACK, d.decisionSource());
                    assertTrue(d.validationMessage().contains("socket closed"));
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("enrichment and history failures are not fatal")
        void degradedContext() {
            MarketIntelligenceResolver broken = mock(MarketIntelligenceResolver.class);
            when(broken.enrich(any())).thenThrow(new IllegalStateException("tables corrupt"));
            when(historicalLearning.historicalContext(any())).thenReturn(Mono.error(new IllegalStateException("db down")));
            when(oracle.propose(any(), any(), any())).thenReturn(Mono.just(OracleResult.proposal(
                StrategyDecision.of(Strategy.PROXY_MAX, 300, 0.7, RiskLevel.MEDIUM, REASONING))));

            StepVerifier.create(newService(broken).decide(ctx(800, 100, 2, 10, null), "trace-5"))
                .assertNext(d -> assertEquals(DecisionSource.LLM, d.decisionSource()))
                .verifyComplete();

            ArgumentCaptor<HistoricalContext> history = ArgumentCaptor.forClass(HistoricalContext.class);
            verify(oracle).propose(any(), isNull(), history.capture());
            assertFalse(history.getValue().hasData());
        }

        @Test
        @DisplayName("history lookup that never answers times out into a rule fallback")
        void historyTimeout() {
            when(historicalLearning.historicalContext(any())).thenReturn(Mono.never());
            when(oracle.propose(any(), any(), any()))
                .thenReturn(Mono.just(OracleResult.failure("oracle not configured: no API key")));
            AuctionDecisionService slowHistory = newService(
                new MarketIntelligenceResolver(MarketIntelligenceSource.empty()), historyStore, 50);

            StepVerifier.create(slowHistory.decide(ctx(1000, 50, 4, 0.5, null), "trace-6"))
                .assertNext(d -> assertEquals(DecisionSource.RULES_FALLBACK, d.decisionSource()))
                .expectComplete()
                .verify(Duration.ofSeconds(5));

            ArgumentCaptor<HistoricalContext> history = ArgumentCaptor.forClass(HistoricalContext.class);
            verify(oracle).propose(any(), any(), history.capture());
            assertFalse(history.getValue().hasData());
        }
    }

    @Nested
    @DisplayName("recording")
    class Recording {

        private FinalDecision decision() {
            return FinalDecision.from(StrategyDecision.of(Strategy.PROXY_MAX, 700, 0.7, RiskLevel.MEDIUM, REASONING),
                null, DecisionSource.LLM, null, "example.com", "trace");
        }

        @Test
        @DisplayName("won outcome derives the margin and defaults the id to the thread")
        void outcome() {
            when(historyStore.recordOutcome(any())).thenReturn(Mono.empty());

            OutcomeRequest request = new OutcomeRequest(ctx(800, 100, 2, 10, "thread-9"), decision(),
                AuctionResult.WON, 600.0, null, null);

            StepVerifier.create(service.recordOutcome(request))
                .assertNext(o -> {
                    assertEquals("thread-9", o.auctionId());
                    assertEquals(0.25, o.profitMargin(), 1e-9);
                    assertEquals(Strategy.PROXY_MAX, o.strategyUsed());
                })
                .verifyComplete();
            verify(historyStore).recordOutcome(any(AuctionOutcome.class));
        }

        @Test
        @DisplayName("explicit auction id wins over the thread id")
        void explicitId() {
            OutcomeRequest request = new OutcomeRequest(ctx(800, 100, 2, 10, "thread-9"), decision(),
                AuctionResult.LOST, null, "a-42", null);

            assertEquals("a-42", AuctionDecisionService.resolveAuctionId(request));
        }

        @Test
        @DisplayName("without any id the domain is used as prefix")
        void generatedId() {
            OutcomeRequest request = new OutcomeRequest(ctx(800, 100, 2, 10, null), decision(),
                AuctionResult.LOST, null, null, null);

            assertTrue(AuctionDecisionService.resolveAuctionId(request).startsWith("example.com_"));
        }

        @Test
        @DisplayName("next round is numbered after the stored ones")
        void roundNumbering() {
            when(historyStore.nextRoundNumber("thread-9")).thenReturn(Mono.just(3));
            when(historyStore.recordRound(any())).thenReturn(Mono.empty());

            StepVerifier.create(service.recordRound(new RoundRequest(ctx(800, 300, 2, 5, "thread-9"), decision(), "leading")))
                .assertNext(r -> {
                    assertEquals(3, r.roundNumber());
                    assertEquals("leading", r.resultRound());
                    assertEquals(300.0, r.currentBidAtDecision(), 1e-9);
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("unreadable round count fails the request without writing a round")
        void roundNumberUnavailable() {
            List<ClientRequest> requests = new ArrayList<>();
            WebClient webClient = WebClient.builder()
                .baseUrl("http://history.test")
                .exchangeFunction(request -> {
                    requests.add(request);
                    HttpStatus status = HttpMethod.GET.equals(request.method()) ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK;
                    return Mono.just(ClientResponse.create(status)
                        .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                        .body("{}")
                        .build());
                })
                .build();
            AuctionDecisionService restBacked = newService(
                new MarketIntelligenceResolver(MarketIntelligenceSource.empty()),
                new HistoryServiceClient(webClient, true), 3000);

            StepVerifier.create(restBacked.recordRound(new RoundRequest(ctx(800, 300, 2, 5, "thread-9"), decision(), "leading")))
                .expectError(WebClientResponseException.class)
                .verify();

            assertEquals(1, requests.size());
            assertEquals(HttpMethod.GET, requests.get(0).method());
            assertTrue(requests.stream().noneMatch(r -> HttpMethod.POST.equals(r.method())));
        }

        @Test
        @DisplayName("context without thread id is not recorded as a round")
        void roundWithoutThread() {
            StepVerifier.create(service.recordRound(new RoundRequest(ctx(800, 300, 2, 5, null), decision(), "leading")))
                .verifyComplete();

            verifyNoInteractions(historyStore);
        }
    }
}
