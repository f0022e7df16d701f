package com.auctionagent.common.pipeline;

import com.auctionagent.common.history.HistoricalContext;
import com.auctionagent.common.intelligence.MarketIntelligence;
import com.auctionagent.common.model.AuctionContext;
import com.auctionagent.common.model.DecisionSource;
import com.auctionagent.common.model.FinalDecision;
import com.auctionagent.common.model.OracleResult;
import com.auctionagent.common.model.ProxyDecision;
import com.auctionagent.common.model.StrategyDecision;
import com.auctionagent.common.model.ValidationResult;
import com.auctionagent.common.safety.SafetyGate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-run accumulator passed between pipeline stages.
 *
 * <p>Owned by exactly one run and never shared, so it is not thread-safe. The input
 * context is immutable; every other field is written at most once by the stage that owns it.
 */
public class PipelineState {

    private final AuctionContext context;
    private final String traceId;
    private final List<PipelineStage> visited = new ArrayList<>();

    private MarketIntelligence intelligence;
    private HistoricalContext history;
    private SafetyGate.Verdict safetyVerdict;
    private OracleResult oracleResult;
    private ValidationResult validation;
    private StrategyDecision fallbackDecision;
    private StrategyDecision chosenDecision;
    private ProxyDecision proxyDecision;
    private DecisionSource decisionSource;
    private FinalDecision finalDecision;

    public PipelineState(AuctionContext context, String traceId) {
        this.context = context;
        this.traceId = traceId;
        visit(PipelineStage.START);
    }

    public void visit(PipelineStage stage) {
        visited.add(stage);
    }

    public List<PipelineStage> visited() {
        return Collections.unmodifiableList(visited);
    }

    public AuctionContext context()                 { return context; }
    public String traceId()                         { return traceId; }
    public MarketIntelligence intelligence()        { return intelligence; }
    public HistoricalContext history()              { return history; }
    public SafetyGate.Verdict safetyVerdict()       { return safetyVerdict; }
    public OracleResult oracleResult()              { return oracleResult; }
    public ValidationResult validation()            { return validation; }
    public StrategyDecision fallbackDecision()      { return fallbackDecision; }
    public StrategyDecision chosenDecision()        { return chosenDecision; }
    public ProxyDecision proxyDecision()            { return proxyDecision; }
    public DecisionSource decisionSource()          { return decisionSource; }
    public FinalDecision finalDecision()            { return finalDecision; }

    public PipelineState intelligence(MarketIntelligence intelligence) {
        this.intelligence = intelligence;
        return this;
    }

    public PipelineState history(HistoricalContext history) {
        this.history = history;
        return this;
    }

    public PipelineState safetyVerdict(SafetyGate.Verdict verdict) {
        this.safetyVerdict = verdict;
        return this;
    }

    public PipelineState oracleResult(OracleResult result) {
        this.oracleResult = result;
        return this;
    }

    public PipelineState validation(ValidationResult validation) {
        this.validation = validation;
        return this;
    }

    public PipelineState fallbackDecision(StrategyDecision decision) {
        this.fallbackDecision = decision;
        return this;
    }

    public PipelineState chosenDecision(StrategyDecision decision, DecisionSource source) {
        this.chosenDecision = decision;
        this.decisionSource = source;
        return this;
    }

    public PipelineState proxyDecision(ProxyDecision proxy) {
        this.proxyDecision = proxy;
        return this;
    }

    public PipelineState finalDecision(FinalDecision decision) {
        this.finalDecision = decision;
        return this;
    }
}
