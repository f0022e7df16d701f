package com.auctionagent.orchestrator.ai;

import com.auctionagent.common.exception.OracleException;
import com.auctionagent.common.history.HistoricalContext;
import com.auctionagent.common.intelligence.MarketIntelligence;
import com.auctionagent.common.model.AuctionContext;
import com.auctionagent.common.model.OracleResult;
import com.auctionagent.common.pipeline.StrategyOracle;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Strategy oracle backed by the Anthropic Messages API.
 *
 * <p><strong>Reactive contract</strong>: no {@code .block()} anywhere. The HTTP call is a
 * {@code Mono} chain with a hard per-attempt timeout and {@link Retry#backoff} between
 * attempts. Transport errors, timeouts, 429 and 5xx responses are retried; malformed
 * replies and 4xx responses are not.
 *
 * <p><strong>Failure contract</strong>: the returned {@code Mono} never errors. Every failure,
 * including a missing API key, completes with {@link OracleResult#failure(String)} and the
 * pipeline falls back to rules.
 */
@Service
public class ClaudeStrategyOracle implements StrategyOracle {

    private static final Logger log = LoggerFactory.getLogger(ClaudeStrategyOracle.class);

    private final WebClient anthropicClient;
    private final ObjectMapper objectMapper;
    private final StrategyPromptBuilder promptBuilder;
    private final OracleResponseParser parser;
    private final OracleSettings settings;

    public ClaudeStrategyOracle(@Qualifier("anthropicClient") WebClient anthropicClient,
                                ObjectMapper objectMapper,
                                StrategyPromptBuilder promptBuilder,
                                OracleResponseParser parser,
                                OracleSettings settings) {
        this.anthropicClient = anthropicClient;
        this.objectMapper = objectMapper;
        this.promptBuilder = promptBuilder;
        this.parser = parser;
        this.settings = settings;
    }

    @Override
    public Mono<OracleResult> propose(AuctionContext ctx, MarketIntelligence intel, HistoricalContext history) {
        if (!settings.configured()) {
            log.warn("[StrategyOracle] No Anthropic API key configured. domain={}", ctx.domain());
            return Mono.just(OracleResult.failure("oracle not configured: no API key"));
        }

        String model = ModelSelector.selectModel(ctx.valueTier());

        return Mono.fromCallable(() -> promptBuilder.userPrompt(ctx, intel, history))
            .flatMap(prompt -> callAnthropicApi(prompt, model)
                .map(parser::extractText)
                .map(parser::parse)
                .retryWhen(retrySpec(ctx.domain())))
            .map(OracleResult::proposal)
            .doOnNext(r -> log.info("[StrategyOracle] Proposal received. strategy={} bid={} confidence={} model={} domain={}",
                r.proposal().strategy().wire(), r.proposal().recommendedBidAmount(),
                r.proposal().confidence(), model, ctx.domain()))
            .onErrorResume(e -> {
                log.error("[StrategyOracle] No proposal. domain={} reason={}", ctx.domain(), e.getMessage());
                return Mono.just(OracleResult.failure(describe(e)));
            });
    }

    // ── Anthropic API call ───────────────────────────────────────────────────

    private Mono<String> callAnthropicApi(String prompt, String model) {
        Map<String, Object> requestBody = Map.of(
            "model", model,
            "max_tokens", settings.maxTokens(),
            "system", promptBuilder.systemPrompt(),
            "messages", List.of(Map.of("role", "user", "content", prompt))
        );

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(requestBody))
            .flatMap(bodyJson ->
                anthropicClient.post()
                    .uri("/v1/messages")
                    .header("x-api-key", settings.apiKey())
                    .bodyValue(bodyJson)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(settings.attemptTimeout()))
            .onErrorMap(ClaudeStrategyOracle::classify);
    }

    private Retry retrySpec(String domain) {
        return Retry.backoff(settings.maxAttempts() - 1L, settings.baseDelay())
            .maxBackoff(settings.maxDelay())
            .filter(e -> e instanceof OracleException oe && oe.isRetryable())
            .doBeforeRetry(signal -> log.warn("[StrategyOracle] Attempt {} failed, retrying. domain={} reason={}",
                signal.totalRetries() + 1, domain, signal.failure().getMessage()))
            .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    static Throwable classify(Throwable e) {
        if (e instanceof OracleException) {
            return e;
        }
        if (e instanceof TimeoutException) {
            return new OracleException(OracleException.Kind.TIMEOUT, "attempt timed out", e);
        }
        if (e instanceof WebClientResponseException wre) {
            int status = wre.getStatusCode().value();
            OracleException.Kind kind = status == 429 || status >= 500
                ? OracleException.Kind.TRANSPORT
                : OracleException.Kind.MALFORMED;
            return new OracleException(kind, "HTTP " + status, e);
        }
        if (e instanceof WebClientRequestException) {
            return new OracleException(OracleException.Kind.TRANSPORT, e.getMessage(), e);
        }
        return new OracleException(OracleException.Kind.TRANSPORT, e.getMessage(), e);
    }

    private static String describe(Throwable e) {
        if (e instanceof OracleException oe) {
            return oe.getMessage();
        }
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }
}
