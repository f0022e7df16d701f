package com.auctionagent.orchestrator.ai;

import com.auctionagent.common.history.AuctionRoundRecord;
import com.auctionagent.common.history.HistoricalContext;
import com.auctionagent.common.history.HistoricalInsights;
import com.auctionagent.common.model.AuctionContext;
import com.auctionagent.common.model.BidderAnalysis;
import com.auctionagent.common.model.DecisionSource;
import com.auctionagent.common.model.Platform;
import com.auctionagent.common.model.Strategy;
import com.auctionagent.common.model.ValueTier;
import com.auctionagent.common.validation.ValidationPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StrategyPromptBuilderTest {

    private final StrategyPromptBuilder builder = new StrategyPromptBuilder(ValidationPolicy.defaults());

    private static final AuctionContext CTX = new AuctionContext("example.com", Platform.GODADDY, 800, 150, 3, 2.5,
        0.0, 5000, BidderAnalysis.neutral(), "thread-1", null);

    @Test
    @DisplayName("system prompt lists every platform's rules")
    void systemPrompt() {
        String prompt = builder.systemPrompt();

        for (Platform p : Platform.values()) {
            assertTrue(prompt.contains(p.ruleSummary()), p.wire());
        }
        assertFalse(prompt.contains("%s"));
    }

    @Test
    @DisplayName("user prompt states the hard ceiling and the reasoning minimum")
    void userPrompt() {
        String prompt = builder.userPrompt(CTX, null, null);

        assertTrue(prompt.contains("Domain: example.com"));
        assertTrue(prompt.contains("Hard ceiling (100% of value): $800.00"));
        assertTrue(prompt.contains("at least 100 characters"));
        assertTrue(prompt.contains("must not exceed $800.00"));
        assertFalse(prompt.contains("Market intelligence:"));
        assertFalse(prompt.contains("History:"));
    }

    @Test
    @DisplayName("history section includes earlier rounds of the thread")
    void historySection() {
        AuctionRoundRecord round = new AuctionRoundRecord("thread-1", 1, "example.com", Platform.GODADDY, 800, 100,
            Strategy.PROXY_MAX, 600, DecisionSource.LLM, 0.7, "outbid", Instant.EPOCH);
        HistoricalContext history = new HistoricalContext(ValueTier.MEDIUM, 0, HistoricalInsights.none(), Map.of(),
            Strategy.LAST_MINUTE_SNIPE, List.of(round));

        String section = builder.historySection(history);

        assertTrue(section.contains("Historically best strategy: last_minute_snipe"));
        assertTrue(section.contains("round 1: proxy_max at $600.00 (bid was $100.00) -> outbid"));
    }

    @Test
    @DisplayName("empty history adds nothing")
    void emptyHistory() {
        assertEquals("", builder.historySection(HistoricalContext.empty(ValueTier.MEDIUM)));
    }
}
