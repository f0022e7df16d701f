package com.auctionagent.orchestrator.config;

import com.auctionagent.common.history.HistoricalLearning;
import com.auctionagent.common.history.HistoryStore;
import com.auctionagent.common.intelligence.MarketIntelligenceResolver;
import com.auctionagent.common.intelligence.MarketIntelligenceSource;
import com.auctionagent.common.validation.ValidationPolicy;
import com.auctionagent.orchestrator.ai.OracleSettings;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class OrchestratorConfig {

    @Value("${services.history.base-url}")
    private String historyUrl;

    @Value("${history.read-timeout-ms:3000}")
    private long historyTimeoutMs;

    // ── Anthropic ────────────────────────────────────────────────────────────
    @Value("${anthropic.api-key:}")
    private String anthropicApiKey;

    @Value("${anthropic.base-url:https://api.anthropic.com}")
    private String anthropicBaseUrl;

    @Value("${anthropic.version:2023-06-01}")
    private String anthropicVersion;

    @Value("${anthropic.max-tokens:2000}")
    private int maxTokens;

    // ── Oracle retry budget ──────────────────────────────────────────────────
    @Value("${oracle.max-attempts:3}")
    private int maxAttempts;

    @Value("${oracle.base-delay-ms:1000}")
    private long baseDelayMs;

    @Value("${oracle.max-delay-ms:10000}")
    private long maxDelayMs;

    @Value("${oracle.attempt-timeout-ms:15000}")
    private long attemptTimeoutMs;

    // ── Validation policy ────────────────────────────────────────────────────
    @Value("${validation.bid-ceiling-ratio:1.00}")
    private double bidCeilingRatio;

    @Value("${validation.min-reasoning-length:50}")
    private int minReasoningLength;

    @Value("${validation.recommended-reasoning-length:100}")
    private int recommendedReasoningLength;

    @Value("${validation.aggressive-early-min-value:200}")
    private double aggressiveEarlyMinValue;

    @Value("${validation.misalignment-margin:0.30}")
    private double misalignmentMargin;

    @Value("${validation.snipe-long-hours:2.0}")
    private double snipeLongHours;

    @Value("${validation.closeout-max-bidders:3}")
    private int closeoutMaxBidders;

    @Bean
    public WebClient historyClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(historyTimeoutMs, 10_000))
            .responseTimeout(Duration.ofMillis(historyTimeoutMs))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(historyTimeoutMs, TimeUnit.MILLISECONDS))
            );

        return builder
            .baseUrl(historyUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .build();
    }

    @Bean
    public WebClient anthropicClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
            .responseTimeout(Duration.ofMillis(attemptTimeoutMs))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(attemptTimeoutMs, TimeUnit.MILLISECONDS))
            );

        return builder
            .baseUrl(anthropicBaseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .defaultHeader("anthropic-version", anthropicVersion)
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public OracleSettings oracleSettings() {
        return new OracleSettings(anthropicApiKey, maxAttempts,
            Duration.ofMillis(baseDelayMs), Duration.ofMillis(maxDelayMs),
            Duration.ofMillis(attemptTimeoutMs), maxTokens);
    }

    @Bean
    public ValidationPolicy validationPolicy() {
        return new ValidationPolicy(bidCeilingRatio, minReasoningLength, recommendedReasoningLength,
            aggressiveEarlyMinValue, misalignmentMargin, snipeLongHours, closeoutMaxBidders);
    }

    @Bean
    public MarketIntelligenceResolver marketIntelligenceResolver(MarketIntelligenceSource source) {
        return new MarketIntelligenceResolver(source);
    }

    @Bean
    public HistoricalLearning historicalLearning(HistoryStore historyStore) {
        return new HistoricalLearning(historyStore);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            org.slf4j.LoggerFactory.getLogger(OrchestratorConfig.class)
                .debug("Outbound request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}
