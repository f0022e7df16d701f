package com.auctionagent.orchestrator.ai;

import com.auctionagent.common.history.HistoricalContext;
import com.auctionagent.common.model.AuctionContext;
import com.auctionagent.common.model.BidderAnalysis;
import com.auctionagent.common.model.OracleResult;
import com.auctionagent.common.model.Platform;
import com.auctionagent.common.model.Strategy;
import com.auctionagent.common.validation.ValidationPolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ClaudeStrategyOracleTest {

    private static final String REPLY =
        "{\"strategy\":\"proxy_max\",\"recommended_bid_amount\":600,\"confidence\":0.7,"
        + "\"risk_level\":\"medium\",\"reasoning\":\"Healthy margin with light competition.\"}";

    private static final AuctionContext CTX = new AuctionContext("example.com", Platform.NAMEJET, 800, 100, 2, 10,
        0.0, 5000, BidderAnalysis.neutral());

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicInteger calls = new AtomicInteger();
    private final List<ClientRequest> requests = new ArrayList<>();

    private ClaudeStrategyOracle oracle(String apiKey, List<ClientResponse> responses) {
        WebClient client = WebClient.builder()
            .baseUrl("http://anthropic.test")
            .exchangeFunction(request -> {
                requests.add(request);
                int n = calls.getAndIncrement();
                return Mono.just(responses.get(Math.min(n, responses.size() - 1)));
            })
            .build();
        OracleSettings settings = new OracleSettings(apiKey, 3, Duration.ofMillis(1), Duration.ofMillis(5),
                                                     Duration.ofSeconds(2), 2000);
        return new ClaudeStrategyOracle(client, objectMapper, new StrategyPromptBuilder(ValidationPolicy.defaults()),
                                        new OracleResponseParser(objectMapper), settings);
    }

    private ClientResponse ok(String text) {
        try {
            String body = objectMapper.writeValueAsString(
                Map.of("content", List.of(Map.of("type", "text", "text", text))));
            return json(HttpStatus.OK, body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }

    private static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body(body)
            .build();
    }

    private Mono<OracleResult> propose(ClaudeStrategyOracle oracle) {
        return oracle.propose(CTX, null, HistoricalContext.empty(CTX.valueTier()));
    }

    @Test
    @DisplayName("no API key → failure without any HTTP call")
    void notConfigured() {
        StepVerifier.create(propose(oracle("", List.of(ok(REPLY)))))
            .assertNext(r -> {
                assertFalse(r.hasProposal());
                assertEquals("oracle not configured: no API key", r.failureReason());
            })
            .verifyComplete();
        assertEquals(0, calls.get());
    }

    @Test
    @DisplayName("successful reply → parsed proposal, api key and path sent")
    void success() {
        StepVerifier.create(propose(oracle("sk-test", List.of(ok(REPLY)))))
            .assertNext(r -> {
                assertTrue(r.hasProposal());
                assertEquals(Strategy.PROXY_MAX, r.proposal().strategy());
                assertEquals(600.0, r.proposal().recommendedBidAmount(), 1e-9);
            })
            .verifyComplete();

        assertEquals(1, calls.get());
        ClientRequest request = requests.get(0);
        assertEquals("/v1/messages", request.url().getPath());
        assertEquals("sk-test", request.headers().getFirst("x-api-key"));
    }

    @Test
    @DisplayName("5xx is retried until a good reply arrives")
    void retriesServerErrors() {
        List<ClientResponse> responses = List.of(
            json(HttpStatus.SERVICE_UNAVAILABLE, "{}"),
            json(HttpStatus.TOO_MANY_REQUESTS, "{}"),
            ok(REPLY));

        StepVerifier.create(propose(oracle("sk-test", responses)))
            .assertNext(r -> assertTrue(r.hasProposal()))
            .verifyComplete();
        assertEquals(3, calls.get());
    }

    @Test
    @DisplayName("persistent 5xx → failure after the attempt budget")
    void exhaustsAttempts() {
        StepVerifier.create(propose(oracle("sk-test", List.of(json(HttpStatus.INTERNAL_SERVER_ERROR, "{}")))))
            .assertNext(r -> {
                assertFalse(r.hasProposal());
                assertTrue(r.failureReason().contains("HTTP 500"));
            })
            .verifyComplete();
        assertEquals(3, calls.get());
    }

    @Test
    @DisplayName("4xx is not retried")
    void clientErrorNotRetried() {
        StepVerifier.create(propose(oracle("sk-test", List.of(json(HttpStatus.BAD_REQUEST, "{}")))))
            .assertNext(r -> assertTrue(r.failureReason().contains("MALFORMED")))
            .verifyComplete();
        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("malformed reply is not retried")
    void malformedNotRetried() {
        StepVerifier.create(propose(oracle("sk-test", List.of(ok("I would rather not say.")))))
            .assertNext(r -> {
                assertFalse(r.hasProposal());
                assertTrue(r.failureReason().contains("no JSON object"));
            })
            .verifyComplete();
        assertEquals(1, calls.get());
    }
}
