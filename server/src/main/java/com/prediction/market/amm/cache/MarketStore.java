package com.prediction.market.amm.cache;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;

import com.prediction.market.amm.entity.Market;
import com.prediction.market.amm.entity.MarketStatus;
import com.prediction.market.amm.repositories.MarketRepository;

import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;

/**
 * Hot, market-id keyed view of markets and their pools.
 *
 * The in-memory copy is what the engine reads and mutates (under the market
 * lock). Mutations mark the market dirty; a scheduled job writes dirty
 * markets behind to the repository. Terminal transitions persist right away.
 */
@Slf4j
public class MarketStore {

    private static final Set<MarketStatus> LIVE_STATUSES =
            EnumSet.of(MarketStatus.ACTIVE, MarketStatus.PAUSED, MarketStatus.ENDED);

    private final ConcurrentHashMap<String, Market> markets = new ConcurrentHashMap<>();
    private final Set<String> dirty = ConcurrentHashMap.newKeySet();
    private final MarketRepository marketRepository;
    private final Retry storageRetry;

    public MarketStore(MarketRepository marketRepository, Retry storageRetry) {
        this.marketRepository = marketRepository;
        this.storageRetry = storageRetry;
    }

    public Optional<Market> find(String marketId) {
        if (marketId == null) {
            return Optional.empty();
        }
        Market cached = markets.get(marketId);
        if (cached != null) {
            return Optional.of(cached);
        }
        return marketRepository.findById(marketId)
                .map(loaded -> {
                    Market existing = markets.putIfAbsent(marketId, loaded);
                    return existing != null ? existing : loaded;
                });
    }

    public void create(Market market) {
        markets.put(market.getId(), market);
        // Persist immediately
        persistNow(market);
    }

    public void markDirty(Market market) {
        dirty.add(market.getId());
    }

    /**
     * Markets currently held in memory.
     */
    public List<Market> snapshot() {
        return new ArrayList<>(markets.values());
    }

    /**
     * Load every non-terminal market so the lifecycle sweep sees them after a restart.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void warmUp() {
        List<Market> live = marketRepository.findByStatusIn(LIVE_STATUSES);
        for (Market market : live) {
            markets.putIfAbsent(market.getId(), market);
        }
        log.info("Loaded {} live markets into the market store", live.size());
    }

    @Scheduled(fixedDelayString = "${amm.flush-interval-ms:1000}")
    public void flushDirty() {
        for (String marketId : new ArrayList<>(dirty)) {
            Market market = markets.get(marketId);
            if (market != null) {
                persistNow(market);
            } else {
                dirty.remove(marketId);
            }
        }
    }

    /**
     * Write the market through to storage. A failed write stays dirty and is
     * retried by the next flush.
     *
     * @return true when the write succeeded
     */
    public boolean persistNow(Market market) {
        dirty.remove(market.getId());
        try {
            storageRetry.executeRunnable(() -> marketRepository.save(market));
            log.debug("Persisted market: {}", market.getId());
            return true;
        } catch (RuntimeException e) {
            dirty.add(market.getId());
            log.error("Failed to persist market: {}", market.getId(), e);
            return false;
        }
    }

    public boolean isDirty(String marketId) {
        return dirty.contains(marketId);
    }

    /**
     * Drop a market from memory. Refused while it has unwritten changes.
     */
    public boolean evict(String marketId) {
        if (dirty.contains(marketId)) {
            return false;
        }
        return markets.remove(marketId) != null;
    }
}
