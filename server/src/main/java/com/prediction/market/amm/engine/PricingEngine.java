package com.prediction.market.amm.engine;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

import com.prediction.market.amm.entity.FixedPoint;
import com.prediction.market.amm.entity.Market;
import com.prediction.market.amm.entity.OutcomePool;

/**
 * Market-level price views over the per-outcome curves.
 */
public class PricingEngine {

    private final PriceNormalization normalization;

    public PricingEngine(PriceNormalization normalization) {
        this.normalization = normalization;
    }

    // Current implied price of every outcome, in outcome order
    public Map<String, BigDecimal> impliedPrices(Market market) {
        Map<String, BigDecimal> raw = new LinkedHashMap<>();
        for (OutcomePool pool : market.getPools()) {
            raw.put(pool.getOutcome(), pool.impliedPrice());
        }
        if (normalization == PriceNormalization.INDEPENDENT) {
            return raw;
        }

        BigDecimal total = FixedPoint.sum(raw.values());
        Map<String, BigDecimal> normalized = new LinkedHashMap<>();
        raw.forEach((outcome, price) -> normalized.put(outcome, FixedPoint.divide(price, total)));
        return normalized;
    }

    public PriceNormalization getNormalization() {
        return normalization;
    }
}
