package com.prediction.market.amm.cache;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import org.springframework.scheduling.annotation.Scheduled;

import com.prediction.market.amm.entity.Payout;
import com.prediction.market.amm.entity.Resolution;
import com.prediction.market.amm.repositories.PayoutRepository;
import com.prediction.market.amm.repositories.ResolutionRepository;

import io.github.resilience4j.retry.Retry;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolutions and payouts. Both are written once and never change, so they
 * are persisted synchronously when recorded. A write that still fails after
 * retries is queued and replayed by the scheduled flush.
 *
 * A payout batch carries a callback that runs once the batch is stored, so
 * positions are only written as closed after their payouts exist.
 */
@Slf4j
public class SettlementStore {

    private final ConcurrentHashMap<String, Resolution> resolutions = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, List<Payout>> payouts = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Resolution> pendingResolutions = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, PendingPayouts> pendingPayouts = new ConcurrentHashMap<>();
    private final ResolutionRepository resolutionRepository;
    private final PayoutRepository payoutRepository;
    private final Retry storageRetry;

    @Value
    private static class PendingPayouts {
        String marketId;
        List<Payout> payouts;
        Runnable onStored;
    }

    public SettlementStore(ResolutionRepository resolutionRepository, PayoutRepository payoutRepository,
            Retry storageRetry) {
        this.resolutionRepository = resolutionRepository;
        this.payoutRepository = payoutRepository;
        this.storageRetry = storageRetry;
    }

    public Optional<Resolution> findResolution(String marketId) {
        Resolution cached = resolutions.get(marketId);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<Resolution> loaded = resolutionRepository.findById(marketId);
        loaded.ifPresent(r -> resolutions.putIfAbsent(marketId, r));
        return loaded;
    }

    /**
     * Record the market's resolution. Returns false if one already exists.
     */
    public boolean recordResolution(Resolution resolution) {
        if (findResolution(resolution.getMarketId()).isPresent()) {
            return false;
        }
        if (resolutions.putIfAbsent(resolution.getMarketId(), resolution) != null) {
            return false;
        }
        if (!save("resolution", resolution.getMarketId(), () -> resolutionRepository.save(resolution))) {
            pendingResolutions.put(resolution.getMarketId(), resolution);
        }
        return true;
    }

    /**
     * Record payouts and write them through. {@code onStored} runs once they
     * are in storage, now or when a queued batch is replayed.
     *
     * @return true when the payouts were stored right away
     */
    public boolean recordPayouts(String marketId, List<Payout> newPayouts, Runnable onStored) {
        if (newPayouts.isEmpty()) {
            onStored.run();
            return true;
        }
        marketPayouts(marketId).addAll(newPayouts);
        if (save("payouts", marketId, () -> payoutRepository.saveAll(newPayouts))) {
            onStored.run();
            return true;
        }
        pendingPayouts.put(newPayouts.get(0).getId(), new PendingPayouts(marketId, newPayouts, onStored));
        return false;
    }

    @Scheduled(fixedDelayString = "${amm.flush-interval-ms:1000}")
    public void flushPending() {
        for (Resolution resolution : new ArrayList<>(pendingResolutions.values())) {
            if (save("resolution", resolution.getMarketId(), () -> resolutionRepository.save(resolution))) {
                pendingResolutions.remove(resolution.getMarketId());
            }
        }
        for (Map.Entry<String, PendingPayouts> entry : new ArrayList<>(pendingPayouts.entrySet())) {
            PendingPayouts batch = entry.getValue();
            if (save("payouts", batch.getMarketId(), () -> payoutRepository.saveAll(batch.getPayouts()))) {
                pendingPayouts.remove(entry.getKey());
                batch.getOnStored().run();
            }
        }
    }

    public boolean hasPendingWrites(String marketId) {
        return pendingResolutions.containsKey(marketId)
                || pendingPayouts.values().stream().anyMatch(b -> b.getMarketId().equals(marketId));
    }

    /**
     * Drop the cached records of a market. Refused while writes are queued.
     */
    public boolean evict(String marketId) {
        if (hasPendingWrites(marketId)) {
            return false;
        }
        resolutions.remove(marketId);
        payouts.remove(marketId);
        return true;
    }

    public List<Payout> payoutsFor(String marketId) {
        return Collections.unmodifiableList(new ArrayList<>(marketPayouts(marketId)));
    }

    private List<Payout> marketPayouts(String marketId) {
        return payouts.computeIfAbsent(marketId,
                id -> new CopyOnWriteArrayList<>(payoutRepository.findByMarketId(id)));
    }

    private boolean save(String what, String marketId, Runnable write) {
        try {
            storageRetry.executeRunnable(write);
            log.debug("Persisted {} for market {}", what, marketId);
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to persist {} for market {}, queued for retry", what, marketId, e);
            return false;
        }
    }
}
