package com.auctionagent.orchestrator.ai;

import com.auctionagent.common.exception.OracleException;
import com.auctionagent.common.model.RiskLevel;
import com.auctionagent.common.model.Strategy;
import com.auctionagent.common.model.StrategyDecision;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Parses the oracle's text reply into a {@link StrategyDecision}.
 *
 * <p>Tolerates markdown fences and prose around the JSON object. Anything that does not
 * yield a well-formed decision raises {@link OracleException} with kind {@code MALFORMED}.
 * Optional fields default: {@code should_increase_proxy} and {@code next_bid_amount} to
 * {@code null}, {@code max_budget_for_domain} to the recommended bid.
 */
@Component
public class OracleResponseParser {

    static final List<String> REQUIRED_FIELDS =
        List.of("strategy", "recommended_bid_amount", "confidence", "risk_level", "reasoning");

    private final ObjectMapper objectMapper;

    public OracleResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /** Pulls {@code content[0].text} out of an Anthropic Messages API response body. */
    public String extractText(String responseBody) {
        try {
            JsonNode text = objectMapper.readTree(responseBody).path("content").path(0).path("text");
            if (!text.isTextual()) {
                throw new OracleException(OracleException.Kind.MALFORMED, "response has no content[0].text");
            }
            return text.asText();
        } catch (JsonProcessingException e) {
            throw new OracleException(OracleException.Kind.MALFORMED, "response body is not JSON", e);
        }
    }

    public StrategyDecision parse(String responseText) {
        if (responseText == null || responseText.isBlank()) {
            throw new OracleException(OracleException.Kind.MALFORMED, "empty reply");
        }
        String cleaned = responseText
            .replace("```json", "")
            .replace("```", "")
            .trim();
        int start = cleaned.indexOf('{');
        int end = cleaned.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new OracleException(OracleException.Kind.MALFORMED, "no JSON object in reply");
        }

        JsonNode json;
        try {
            json = objectMapper.readTree(cleaned.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            throw new OracleException(OracleException.Kind.MALFORMED, "invalid JSON: " + e.getOriginalMessage(), e);
        }

        for (String field : REQUIRED_FIELDS) {
            if (!json.hasNonNull(field)) {
                throw new OracleException(OracleException.Kind.MALFORMED, "missing field '" + field + "'");
            }
        }
        if (!json.get("recommended_bid_amount").isNumber() || !json.get("confidence").isNumber()) {
            throw new OracleException(OracleException.Kind.MALFORMED, "non-numeric bid or confidence");
        }

        try {
            Strategy strategy = Strategy.fromWire(json.get("strategy").asText());
            RiskLevel risk = RiskLevel.fromWire(json.get("risk_level").asText());
            double bid = json.get("recommended_bid_amount").asDouble();
            double confidence = json.get("confidence").asDouble();

            Boolean increaseProxy = json.hasNonNull("should_increase_proxy")
                ? json.get("should_increase_proxy").asBoolean() : null;
            Double nextBid = json.hasNonNull("next_bid_amount")
                ? json.get("next_bid_amount").asDouble() : null;
            double maxBudget = json.hasNonNull("max_budget_for_domain")
                ? json.get("max_budget_for_domain").asDouble() : bid;

            return new StrategyDecision(strategy, bid, confidence, risk, json.get("reasoning").asText(),
                                        increaseProxy, nextBid, maxBudget);
        } catch (IllegalArgumentException e) {
            throw new OracleException(OracleException.Kind.MALFORMED, e.getMessage(), e);
        }
    }
}
