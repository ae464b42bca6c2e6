package com.prediction.market.amm.entity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class MarketTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private Market market;

    @BeforeEach
    void setUp() {
        market = Market.open("m-1", "Who wins?", null, "creator", List.of("Red", "Blue", "Green"),
                new BigDecimal("1000"), NOW, NOW.plusSeconds(3600), NOW.plusSeconds(7200));
    }

    @Test
    @DisplayName("Opening creates one pool per outcome in outcome order")
    void open() {
        assertThat(market.getStatus()).isEqualTo(MarketStatus.ACTIVE);
        assertThat(market.getPools()).extracting(OutcomePool::getOutcome).containsExactly("Red", "Blue", "Green");
        assertThat(market.getPools()).allSatisfy(p -> assertThat(p.getK()).isEqualByComparingTo("1000000"));
    }

    @Test
    void outcomesMatchCaseInsensitively() {
        assertThat(market.canonicalOutcome(" blue ")).contains("Blue");
        assertThat(market.canonicalOutcome("purple")).isEmpty();
        assertThat(market.canonicalOutcome(null)).isEmpty();
    }

    @Test
    void endTimeIsExclusive() {
        assertThat(market.hasEndTimePassed(NOW.plusSeconds(3599))).isFalse();
        assertThat(market.hasEndTimePassed(NOW.plusSeconds(3600))).isTrue();
    }

    @Nested
    @DisplayName("compareAndTransition")
    class CompareAndTransition {

        @Test
        void appliesWhenStatusMatches() {
            assertThat(market.compareAndTransition(MarketStatus.ACTIVE, MarketStatus.PAUSED, NOW)).isTrue();
            assertThat(market.getStatus()).isEqualTo(MarketStatus.PAUSED);
        }

        @Test
        void refusesWhenStatusDiffers() {
            assertThat(market.compareAndTransition(MarketStatus.ENDED, MarketStatus.RESOLVED, NOW)).isFalse();
            assertThat(market.getStatus()).isEqualTo(MarketStatus.ACTIVE);
        }

        @Test
        void illegalPairThrows() {
            assertThatThrownBy(() -> market.compareAndTransition(MarketStatus.ACTIVE, MarketStatus.RESOLVED, NOW))
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    @ParameterizedTest(name = "{0} -> {1} allowed={2}")
    @CsvSource({
            "ACTIVE, PAUSED, true",
            "ACTIVE, ENDED, true",
            "ACTIVE, CANCELLED, true",
            "ACTIVE, RESOLVED, false",
            "PAUSED, ACTIVE, true",
            "PAUSED, ENDED, true",
            "PAUSED, REFUNDED, false",
            "ENDED, RESOLVED, true",
            "ENDED, REFUNDED, true",
            "ENDED, CANCELLED, true",
            "ENDED, ACTIVE, false",
            "RESOLVED, REFUNDED, false",
            "REFUNDED, ACTIVE, false",
            "CANCELLED, ENDED, false"
    })
    void statusTransitions(MarketStatus from, MarketStatus to, boolean allowed) {
        assertThat(from.canTransitionTo(to)).isEqualTo(allowed);
    }
}
