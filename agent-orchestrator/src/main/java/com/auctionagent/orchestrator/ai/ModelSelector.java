package com.auctionagent.orchestrator.ai;

import com.auctionagent.common.model.ValueTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Value-aware model selector.
 *
 * <ul>
 *   <li>{@code HIGH} tier → strong model (Sonnet): a mistake on a $1000+ name costs more
 *       than the extra latency.</li>
 *   <li>{@code MEDIUM} and {@code LOW} → fast model (Haiku).</li>
 * </ul>
 *
 * <p>Pure static utility. Model names are constants, not configuration.
 */
public final class ModelSelector {

    private static final Logger log = LoggerFactory.getLogger(ModelSelector.class);

    public static final String CHEAP_MODEL  = "claude-haiku-4-5-20251001";
    public static final String STRONG_MODEL = "claude-sonnet-4-6";

    private ModelSelector() {}

    public static String selectModel(ValueTier tier) {
        String selected = tier == ValueTier.HIGH ? STRONG_MODEL : CHEAP_MODEL;
        log.debug("ORACLE_MODEL_SELECTED tier={} model={}", tier, selected);
        return selected;
    }
}
