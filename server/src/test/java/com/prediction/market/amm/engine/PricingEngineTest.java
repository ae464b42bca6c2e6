package com.prediction.market.amm.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.prediction.market.amm.entity.FixedPoint;
import com.prediction.market.amm.entity.Market;

class PricingEngineTest {

    private Market market;

    @BeforeEach
    void setUp() {
        Instant now = Instant.parse("2026-01-01T00:00:00Z");
        market = Market.open("m-1", "Which?", null, "creator", List.of("A", "B", "C"),
                new BigDecimal("30000"), now, now.plusSeconds(60), now.plusSeconds(120));
        market.pool("A").applyBuy(new BigDecimal("1000"));
    }

    @Test
    @DisplayName("Independent prices are each pool's own curve price")
    void independent() {
        Map<String, BigDecimal> prices = new PricingEngine(PriceNormalization.INDEPENDENT).impliedPrices(market);

        assertThat(prices.keySet()).containsExactly("A", "B", "C");
        assertThat(prices.get("A")).isEqualByComparingTo("0.51638904");
        assertThat(prices.get("B")).isEqualByComparingTo("0.5");
        assertThat(FixedPoint.sum(prices.values())).isGreaterThan(BigDecimal.ONE);
    }

    @Test
    @DisplayName("Normalized prices sum to one and keep their order")
    void normalized() {
        Map<String, BigDecimal> prices = new PricingEngine(PriceNormalization.NORMALIZED).impliedPrices(market);

        assertThat(FixedPoint.sum(prices.values())).isCloseTo(BigDecimal.ONE, within(new BigDecimal("0.00000003")));
        assertThat(prices.get("A")).isGreaterThan(prices.get("B"));
        assertThat(prices.get("B")).isEqualByComparingTo(prices.get("C"));
    }
}
