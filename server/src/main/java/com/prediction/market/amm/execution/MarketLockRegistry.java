package com.prediction.market.amm.execution;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import com.prediction.market.amm.result.EngineResult;
import com.prediction.market.amm.result.ErrorCode;

import lombok.extern.slf4j.Slf4j;

/**
 * Arena of per-market execution locks, keyed by market id.
 *
 * Every trade, status transition and settlement of a market runs inside
 * {@link #executeWithLock(String, Supplier)}, so they never interleave.
 * Different markets have different locks and proceed in parallel.
 * Locks are fair: waiting requests acquire in arrival order.
 * Locks are reentrant so resolution can settle inside its own scope.
 *
 * An entry lives only while some thread holds or waits for it. Users are
 * counted inside {@code compute}, so an entry is never removed while a
 * thread is about to lock it.
 */
@Slf4j
public class MarketLockRegistry {

    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock(true);
        // Guarded by the map's per-key compute
        private int users;
    }

    private final ConcurrentHashMap<String, LockEntry> locks = new ConcurrentHashMap<>();
    private final Duration timeout;

    public MarketLockRegistry(Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("Lock timeout must be non-negative");
        }
        this.timeout = timeout;
    }

    /**
     * Run {@code action} holding the market's lock. Fails with MARKET_BUSY when
     * the lock is not acquired within the timeout. The lock is released on
     * every exit path, exceptions included.
     */
    public <T> EngineResult<T> executeWithLock(String marketId, Supplier<EngineResult<T>> action) {
        LockEntry entry = locks.compute(marketId, (id, existing) -> {
            LockEntry held = existing != null ? existing : new LockEntry();
            held.users++;
            return held;
        });
        try {
            return runLocked(marketId, entry.lock, action);
        } finally {
            locks.computeIfPresent(marketId, (id, held) -> --held.users == 0 ? null : held);
        }
    }

    private <T> EngineResult<T> runLocked(String marketId, ReentrantLock lock, Supplier<EngineResult<T>> action) {
        boolean acquired;
        try {
            acquired = lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return busy(marketId);
        }
        if (!acquired) {
            log.warn("Market lock timeout: marketId={}, waitedMs={}", marketId, timeout.toMillis());
            return busy(marketId);
        }

        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public boolean isHeldByCurrentThread(String marketId) {
        LockEntry entry = locks.get(marketId);
        return entry != null && entry.lock.isHeldByCurrentThread();
    }

    /**
     * Number of markets with a live lock entry.
     */
    public int activeLocks() {
        return locks.size();
    }

    private static <T> EngineResult<T> busy(String marketId) {
        return EngineResult.failure(ErrorCode.MARKET_BUSY, "Market is busy, retry shortly: " + marketId);
    }
}
