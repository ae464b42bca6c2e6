package com.prediction.market.amm.cache;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import org.springframework.scheduling.annotation.Scheduled;

import com.prediction.market.amm.entity.Position;
import com.prediction.market.amm.repositories.PositionRepository;

import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;

/**
 * Positions of each market, in placement order. Append-only until
 * settlement changes their status. Writes are buffered and flushed like
 * {@link MarketStore}.
 *
 * Settlement withholds the positions it closes until their payouts are
 * stored; withheld positions are skipped by every flush.
 */
@Slf4j
public class PositionStore {

    private final ConcurrentHashMap<String, List<Position>> positions = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Position> dirty = new ConcurrentHashMap<>();
    private final Set<String> withheld = ConcurrentHashMap.newKeySet();
    private final PositionRepository positionRepository;
    private final Retry storageRetry;

    public PositionStore(PositionRepository positionRepository, Retry storageRetry) {
        this.positionRepository = positionRepository;
        this.storageRetry = storageRetry;
    }

    public void append(Position position) {
        marketPositions(position.getMarketId()).add(position);
        dirty.put(position.getId(), position);
    }

    public List<Position> forMarket(String marketId) {
        return Collections.unmodifiableList(marketPositions(marketId));
    }

    public List<Position> forUser(String marketId, String userId) {
        return marketPositions(marketId).stream()
                .filter(p -> p.getUserId().equals(userId))
                .collect(Collectors.toList());
    }

    /**
     * Keep these positions out of storage until {@link #release}.
     */
    public void withhold(Collection<Position> held) {
        held.forEach(p -> withheld.add(p.getId()));
    }

    /**
     * Let withheld positions be written again, marking them dirty.
     */
    public void release(Collection<Position> held) {
        for (Position position : held) {
            dirty.put(position.getId(), position);
            withheld.remove(position.getId());
        }
    }

    @Scheduled(fixedDelayString = "${amm.flush-interval-ms:1000}")
    public void flushDirty() {
        persist(dirty.values().stream()
                .filter(p -> !withheld.contains(p.getId()))
                .collect(Collectors.toList()));
    }

    /**
     * Write every dirty position of one market now.
     */
    public boolean flushMarket(String marketId) {
        List<Position> pending = dirty.values().stream()
                .filter(p -> p.getMarketId().equals(marketId) && !withheld.contains(p.getId()))
                .collect(Collectors.toList());
        return persist(pending);
    }

    public boolean hasDirty(String marketId) {
        return dirty.values().stream().anyMatch(p -> p.getMarketId().equals(marketId));
    }

    /**
     * Drop a market's positions from memory. Refused while any is unwritten.
     */
    public boolean evict(String marketId) {
        if (hasDirty(marketId)) {
            return false;
        }
        positions.remove(marketId);
        return true;
    }

    private boolean persist(List<Position> pending) {
        if (pending.isEmpty()) {
            return true;
        }
        pending.forEach(p -> dirty.remove(p.getId(), p));
        try {
            storageRetry.executeRunnable(() -> positionRepository.saveAll(pending));
            log.debug("Persisted {} positions", pending.size());
            return true;
        } catch (RuntimeException e) {
            pending.forEach(p -> dirty.putIfAbsent(p.getId(), p));
            log.error("Failed to persist {} positions, will retry", pending.size(), e);
            return false;
        }
    }

    private List<Position> marketPositions(String marketId) {
        return positions.computeIfAbsent(marketId,
                id -> new CopyOnWriteArrayList<>(positionRepository.findByMarketIdOrderByPlacedAtAsc(id)));
    }
}
