package com.prediction.market.amm.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyIterable;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.prediction.market.amm.entity.MarketStatus;
import com.prediction.market.amm.entity.Payout;
import com.prediction.market.amm.entity.PayoutKind;
import com.prediction.market.amm.entity.Resolution;
import com.prediction.market.amm.entity.ResolutionMethod;
import com.prediction.market.amm.repositories.PayoutRepository;
import com.prediction.market.amm.repositories.ResolutionRepository;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;

class SettlementStoreTest {

    private ResolutionRepository resolutionRepository;
    private PayoutRepository payoutRepository;
    private SettlementStore store;

    @BeforeEach
    void setUp() {
        resolutionRepository = mock(ResolutionRepository.class);
        payoutRepository = mock(PayoutRepository.class);
        store = new SettlementStore(resolutionRepository, payoutRepository,
                Retry.of("test", RetryConfig.custom().maxAttempts(1).build()));
    }

    private static Payout refund(String positionId) {
        return Payout.builder()
                .id("payout-" + positionId)
                .marketId("m-1")
                .positionId(positionId)
                .userId("alice")
                .outcome("Yes")
                .kind(PayoutKind.REFUND)
                .amountPaid(new BigDecimal("10"))
                .grossAmount(new BigDecimal("10"))
                .fee(BigDecimal.ZERO)
                .netAmount(new BigDecimal("10"))
                .profitLoss(BigDecimal.ZERO)
                .createdAt(Instant.parse("2026-01-01T00:00:00Z"))
                .build();
    }

    private static Resolution resolution(String marketId) {
        return Resolution.builder()
                .marketId(marketId)
                .finalStatus(MarketStatus.REFUNDED)
                .method(ResolutionMethod.AUTO_REFUND)
                .resolvedBy("system")
                .resolvedAt(Instant.parse("2026-01-01T00:00:00Z"))
                .build();
    }

    @Test
    @DisplayName("Only the first resolution of a market is recorded")
    void recordsOnce() {
        assertThat(store.recordResolution(resolution("m-1"))).isTrue();
        assertThat(store.recordResolution(resolution("m-1"))).isFalse();
        verify(resolutionRepository, times(1)).save(any(Resolution.class));
    }

    @Test
    void storedResolutionBlocksNewOne() {
        when(resolutionRepository.findById("m-1")).thenReturn(Optional.of(resolution("m-1")));

        assertThat(store.recordResolution(resolution("m-1"))).isFalse();
    }

    @Test
    @DisplayName("A failed write is replayed by the next flush")
    void failedWriteIsReplayed() {
        when(resolutionRepository.save(any(Resolution.class)))
                .thenThrow(new IllegalStateException("mongo down"))
                .thenAnswer(invocation -> invocation.getArgument(0));

        assertThat(store.recordResolution(resolution("m-1"))).isTrue();
        store.flushPending();
        store.flushPending();

        verify(resolutionRepository, times(2)).save(any(Resolution.class));
        assertThat(store.findResolution("m-1")).isPresent();
    }

    @Test
    @DisplayName("The stored callback of a failed payout batch runs when the batch is replayed")
    void payoutCallbackWaitsForStorage() {
        when(payoutRepository.saveAll(anyIterable()))
                .thenThrow(new IllegalStateException("mongo down"))
                .thenAnswer(invocation -> invocation.getArgument(0));
        AtomicInteger stored = new AtomicInteger();

        assertThat(store.recordPayouts("m-1", List.of(refund("p-1")), stored::incrementAndGet)).isFalse();
        assertThat(stored.get()).isZero();
        assertThat(store.hasPendingWrites("m-1")).isTrue();
        assertThat(store.evict("m-1")).isFalse();

        store.flushPending();

        assertThat(stored.get()).isEqualTo(1);
        assertThat(store.hasPendingWrites("m-1")).isFalse();
        assertThat(store.payoutsFor("m-1")).hasSize(1);
        assertThat(store.evict("m-1")).isTrue();
    }
}
