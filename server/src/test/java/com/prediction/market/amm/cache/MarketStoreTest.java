package com.prediction.market.amm.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.prediction.market.amm.entity.Market;
import com.prediction.market.amm.repositories.MarketRepository;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;

class MarketStoreTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private MarketRepository marketRepository;
    private MarketStore store;

    @BeforeEach
    void setUp() {
        marketRepository = mock(MarketRepository.class);
        Retry retry = Retry.of("test", RetryConfig.custom()
                .maxAttempts(2)
                .waitDuration(Duration.ofMillis(1))
                .build());
        store = new MarketStore(marketRepository, retry);
    }

    private static Market market(String id) {
        return Market.open(id, "Q?", null, "c", List.of("Yes", "No"), new BigDecimal("100"),
                NOW, NOW.plusSeconds(60), NOW.plusSeconds(120));
    }

    @Test
    @DisplayName("A cache miss loads from the repository once")
    void loadsOnMiss() {
        Market stored = market("m-1");
        when(marketRepository.findById("m-1")).thenReturn(Optional.of(stored));

        assertThat(store.find("m-1")).containsSame(stored);
        assertThat(store.find("m-1")).containsSame(stored);
        verify(marketRepository, times(1)).findById("m-1");
    }

    @Test
    void unknownMarketIsEmpty() {
        assertThat(store.find("nope")).isEmpty();
        assertThat(store.find(null)).isEmpty();
    }

    @Test
    @DisplayName("Dirty markets are written behind and then clean")
    void flushesDirtyMarkets() {
        Market market = market("m-1");
        store.create(market);
        store.markDirty(market);

        store.flushDirty();

        assertThat(store.isDirty("m-1")).isFalse();
        verify(marketRepository, times(2)).save(market);
    }

    @Test
    @DisplayName("A write that keeps failing is retried, logged, and stays dirty")
    void failedWriteStaysDirty() {
        Market market = market("m-1");
        when(marketRepository.save(any(Market.class))).thenThrow(new IllegalStateException("mongo down"));

        boolean persisted = store.persistNow(market);

        assertThat(persisted).isFalse();
        assertThat(store.isDirty("m-1")).isTrue();
        verify(marketRepository, times(2)).save(market);
    }

    @Test
    void warmUpLoadsLiveMarkets() {
        Market live = market("m-live");
        when(marketRepository.findByStatusIn(any())).thenReturn(List.of(live));

        store.warmUp();

        assertThat(store.snapshot()).containsExactly(live);
    }
}
