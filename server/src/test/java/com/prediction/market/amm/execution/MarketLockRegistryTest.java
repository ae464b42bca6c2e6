package com.prediction.market.amm.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.prediction.market.amm.result.EngineResult;
import com.prediction.market.amm.result.ErrorCode;
import com.prediction.market.amm.result.ErrorKind;

class MarketLockRegistryTest {

    private MarketLockRegistry registry;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        registry = new MarketLockRegistry(Duration.ofMillis(50));
        executor = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("A held market lock makes other callers fail with MARKET_BUSY after the timeout")
    void busyWhenHeld() throws Exception {
        CountDownLatch acquired = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Future<EngineResult<String>> holder = executor.submit(() -> registry.executeWithLock("m-1", () -> {
            acquired.countDown();
            await(release);
            return EngineResult.success("held");
        }));
        assertThat(acquired.await(5, TimeUnit.SECONDS)).isTrue();

        EngineResult<String> blocked = registry.executeWithLock("m-1", () -> EngineResult.success("never"));

        assertThat(blocked.isFailure()).isTrue();
        assertThat(blocked.getError().getCode()).isEqualTo(ErrorCode.MARKET_BUSY);
        assertThat(blocked.getError().getKind()).isEqualTo(ErrorKind.RESOURCE_BUSY);
        assertThat(blocked.getError().getKind().isRetryable()).isTrue();

        release.countDown();
        assertThat(holder.get(5, TimeUnit.SECONDS).getValue()).isEqualTo("held");
    }

    @Test
    @DisplayName("Different markets never share a lock")
    void marketsAreIndependent() throws Exception {
        CountDownLatch acquired = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        executor.submit(() -> registry.executeWithLock("m-1", () -> {
            acquired.countDown();
            await(release);
            return EngineResult.success("held");
        }));
        assertThat(acquired.await(5, TimeUnit.SECONDS)).isTrue();

        EngineResult<String> other = registry.executeWithLock("m-2", () -> EngineResult.success("free"));

        assertThat(other.getValue()).isEqualTo("free");
        release.countDown();
    }

    @Test
    @DisplayName("The lock is released when the action throws")
    void releasedOnException() {
        assertThatThrownBy(() -> registry.executeWithLock("m-1", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(registry.isHeldByCurrentThread("m-1")).isFalse();
        assertThat(registry.executeWithLock("m-1", () -> EngineResult.success(1)).getValue()).isEqualTo(1);
    }

    @Test
    void reentrantForTheSameThread() {
        EngineResult<String> nested = registry.executeWithLock("m-1",
                () -> registry.executeWithLock("m-1", () -> EngineResult.success("inner")));

        assertThat(nested.getValue()).isEqualTo("inner");
        assertThat(registry.activeLocks()).isZero();
    }

    @Test
    @DisplayName("A lock entry lives only while a caller holds or waits for it")
    void idleEntriesAreDropped() throws Exception {
        registry.executeWithLock("m-1", () -> EngineResult.success(1));
        assertThat(registry.activeLocks()).isZero();

        CountDownLatch acquired = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Future<EngineResult<String>> holder = executor.submit(() -> registry.executeWithLock("m-1", () -> {
            acquired.countDown();
            await(release);
            return EngineResult.success("held");
        }));
        assertThat(acquired.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(registry.activeLocks()).isEqualTo(1);

        release.countDown();
        holder.get(5, TimeUnit.SECONDS);
        assertThat(registry.activeLocks()).isZero();
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
