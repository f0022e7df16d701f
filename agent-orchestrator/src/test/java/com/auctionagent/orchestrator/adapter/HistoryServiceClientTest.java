package com.auctionagent.orchestrator.adapter;

import com.auctionagent.common.history.AuctionOutcome;
import com.auctionagent.common.model.AuctionResult;
import com.auctionagent.common.model.DecisionSource;
import com.auctionagent.common.model.Platform;
import com.auctionagent.common.model.Strategy;
import com.auctionagent.common.model.ValueTier;
import com.auctionagent.common.trace.TraceContextUtil;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HistoryServiceClientTest {

    private final List<ClientRequest> requests = new ArrayList<>();

    private HistoryServiceClient client(HttpStatus status, String body, boolean enabled) {
        WebClient webClient = WebClient.builder()
            .baseUrl("http://history.test")
            .exchangeFunction(request -> {
                requests.add(request);
                return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build());
            })
            .build();
        return new HistoryServiceClient(webClient, enabled);
    }

    private static AuctionOutcome outcome() {
        return new AuctionOutcome("a-1", "example.com", Platform.GODADDY, Instant.EPOCH, 800, 100, 600.0, 2, 5,
            false, Strategy.PROXY_MAX, 700, DecisionSource.LLM, 0.7, AuctionResult.WON, 0.25, null);
    }

    @Test
    @DisplayName("best strategy is read from the wire name")
    void bestStrategy() {
        HistoryServiceClient c = client(HttpStatus.OK, "{\"strategy\":\"last_minute_snipe\"}", true);

        StepVerifier.create(c.getBestStrategyForContext(Platform.GODADDY, ValueTier.HIGH, 5))
            .expectNext(Strategy.LAST_MINUTE_SNIPE)
            .verifyComplete();

        ClientRequest request = requests.get(0);
        assertEquals("/api/v1/history/best-strategy", request.url().getPath());
        assertTrue(request.url().getQuery().contains("valueTier=high"));
        assertTrue(request.url().getQuery().contains("minSamples=5"));
    }

    @Test
    @DisplayName("404 on best strategy → empty")
    void bestStrategyMissing() {
        StepVerifier.create(client(HttpStatus.NOT_FOUND, "{}", true)
                .getBestStrategyForContext(Platform.GODADDY, ValueTier.HIGH, 5))
            .verifyComplete();
    }

    @Test
    @DisplayName("failed performance read degrades to zero uses")
    void performanceDegrades() {
        StepVerifier.create(client(HttpStatus.INTERNAL_SERVER_ERROR, "{}", true)
                .getStrategyPerformance(Strategy.PROXY_MAX, Platform.NAMEJET, null))
            .assertNext(p -> {
                assertEquals(0, p.totalUses());
                assertEquals(Strategy.PROXY_MAX, p.strategy());
            })
            .verifyComplete();
        assertFalse(requests.get(0).url().getQuery().contains("valueTier"));
    }

    @Test
    @DisplayName("failed similar-auction read completes empty")
    void similarDegrades() {
        StepVerifier.create(client(HttpStatus.SERVICE_UNAVAILABLE, "{}", true)
                .getSimilarAuctions(Platform.NAMEJET, 560, 1040, 10))
            .verifyComplete();
    }

    @Test
    @DisplayName("failed write propagates and carries the trace id")
    void writeFails() {
        HistoryServiceClient c = client(HttpStatus.INTERNAL_SERVER_ERROR, "{}", true);

        StepVerifier.create(TraceContextUtil.withTrace(c.recordOutcome(outcome()), "trace-7", "example.com"))
            .expectError(WebClientResponseException.class)
            .verify();

        ClientRequest request = requests.get(0);
        assertEquals("/api/v1/history/outcomes", request.url().getPath());
        assertEquals("trace-7", request.headers().getFirst("X-Trace-Id"));
    }

    @Test
    @DisplayName("next round number is read from the thread's next-number resource")
    void nextRoundNumber() {
        HistoryServiceClient c = client(HttpStatus.OK, "{\"next_round_number\":4}", true);

        StepVerifier.create(c.nextRoundNumber("thread-1"))
            .expectNext(4)
            .verifyComplete();
        assertEquals("/api/v1/history/rounds/thread-1/next-number", requests.get(0).url().getPath());
    }

    @Test
    @DisplayName("failed next round number read propagates instead of restarting at 1")
    void nextRoundNumberFails() {
        StepVerifier.create(client(HttpStatus.SERVICE_UNAVAILABLE, "{}", true).nextRoundNumber("thread-1"))
            .expectError(WebClientResponseException.ServiceUnavailable.class)
            .verify();
    }

    @Test
    @DisplayName("failed round lookup completes empty")
    void roundsDegrade() {
        HistoryServiceClient c = client(HttpStatus.SERVICE_UNAVAILABLE, "{}", true);

        StepVerifier.create(TraceContextUtil.withTrace(c.getRoundsForThread("thread-1").collectList(), "trace-8", "example.com"))
            .assertNext(rounds -> assertTrue(rounds.isEmpty()))
            .verifyComplete();
        assertEquals("trace-8", requests.get(0).headers().getFirst("X-Trace-Id"));
    }

    @Test
    @DisplayName("disabled client never calls out")
    void disabled() {
        HistoryServiceClient c = client(HttpStatus.OK, "{}", false);

        StepVerifier.create(c.recordOutcome(outcome())).verifyComplete();
        StepVerifier.create(c.getRoundsForThread("thread-1")).verifyComplete();
        StepVerifier.create(c.nextRoundNumber("thread-1")).expectNext(1).verifyComplete();
        StepVerifier.create(c.getStrategyPerformance(Strategy.PROXY_MAX, null, null))
            .assertNext(p -> assertEquals(0, p.totalUses()))
            .verifyComplete();
        assertTrue(requests.isEmpty());
    }
}
