package com.prediction.market.amm.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import com.prediction.market.amm.cache.MarketStore;
import com.prediction.market.amm.cache.PositionStore;
import com.prediction.market.amm.cache.SettlementStore;
import com.prediction.market.amm.cache.VoteStore;
import com.prediction.market.amm.config.AmmProperties;
import com.prediction.market.amm.entity.FixedPoint;
import com.prediction.market.amm.entity.Market;
import com.prediction.market.amm.entity.MarketStatus;
import com.prediction.market.amm.entity.ResolutionMethod;
import com.prediction.market.amm.execution.MarketLockRegistry;
import com.prediction.market.amm.result.EngineResult;
import com.prediction.market.amm.result.ErrorCode;
import com.prediction.market.amm.result.InvariantViolationException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Market creation and every non-resolution status change.
 *
 * Transitions are compare-and-set on status under the market lock. Refund
 * and cancel hand over to {@link SettlementEngine}, which records the
 * resolution and pays out in the same lock scope.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MarketLifecycleService {

    static final String SYSTEM_ACTOR = "system";

    private final MarketStore marketStore;
    private final PositionStore positionStore;
    private final VoteStore voteStore;
    private final SettlementStore settlementStore;
    private final SettlementEngine settlementEngine;
    private final MarketLockRegistry lockRegistry;
    private final AmmProperties properties;
    private final Clock clock;

    public EngineResult<Market> createMarket(MarketDefinition definition) {
        Instant now = clock.instant();

        if (definition.getQuestion() == null || definition.getQuestion().isBlank()) {
            return invalid("Question is required");
        }
        List<String> outcomes = definition.getOutcomes();
        if (outcomes == null || outcomes.size() < Market.MIN_OUTCOMES || outcomes.size() > Market.MAX_OUTCOMES) {
            return invalid(String.format("A market needs %d to %d outcomes", Market.MIN_OUTCOMES, Market.MAX_OUTCOMES));
        }
        List<String> labels = new ArrayList<>(outcomes.size());
        Set<String> seen = new HashSet<>();
        for (String outcome : outcomes) {
            if (outcome == null || outcome.isBlank()) {
                return invalid("Outcome labels cannot be blank");
            }
            String label = outcome.trim();
            if (!seen.add(label.toLowerCase(Locale.ROOT))) {
                return invalid("Duplicate outcome: " + label);
            }
            labels.add(label);
        }

        BigDecimal liquidity = definition.getInitialLiquidity() != null
                ? definition.getInitialLiquidity()
                : properties.getDefaultInitialLiquidity();
        if (liquidity.signum() <= 0 || !FixedPoint.fitsScale(liquidity)) {
            return invalid("Initial liquidity must be positive with at most 8 decimals");
        }

        if (definition.getEndTime() == null || !definition.getEndTime().isAfter(now)) {
            return invalid("End time must be in the future");
        }
        Instant deadline = definition.getResolutionDeadline();
        if (deadline == null) {
            deadline = definition.getEndTime().plus(properties.getAutoRefundWindow());
        } else if (!deadline.isAfter(definition.getEndTime())) {
            return invalid("Resolution deadline must be after the end time");
        }

        Market market = Market.open(UUID.randomUUID().toString(), definition.getQuestion().trim(),
                definition.getDescription(), definition.getCreatorId(), labels, liquidity,
                now, definition.getEndTime(), deadline);
        marketStore.create(market);

        log.info("Market created: marketId={}, outcomes={}, initialLiquidity={}, endTime={}",
                market.getId(), labels, liquidity.toPlainString(), market.getEndTime());
        return EngineResult.success(market);
    }

    public EngineResult<Market> pause(String marketId) {
        return transition(marketId, EnumSet.of(MarketStatus.ACTIVE), MarketStatus.PAUSED);
    }

    public EngineResult<Market> resume(String marketId) {
        return withMarket(marketId, market -> lockRegistry.executeWithLock(marketId, () -> {
            if (market.hasEndTimePassed(clock.instant())) {
                return EngineResult.failure(ErrorCode.MARKET_ENDED,
                        "Cannot resume a market past its end time: " + marketId);
            }
            return transitionLocked(market, EnumSet.of(MarketStatus.PAUSED), MarketStatus.ACTIVE);
        }));
    }

    /**
     * Admin close: stop trading before the end time.
     */
    public EngineResult<Market> close(String marketId) {
        return transition(marketId, EnumSet.of(MarketStatus.ACTIVE, MarketStatus.PAUSED), MarketStatus.ENDED);
    }

    /**
     * End the market if its end time has passed. Caller holds the market lock.
     *
     * @return true if the status changed
     */
    boolean closeIfExpired(Market market) {
        Instant now = clock.instant();
        MarketStatus current = market.getStatus();
        if ((current != MarketStatus.ACTIVE && current != MarketStatus.PAUSED) || !market.hasEndTimePassed(now)) {
            return false;
        }
        boolean changed = market.compareAndTransition(current, MarketStatus.ENDED, now);
        if (changed) {
            marketStore.markDirty(market);
            log.info("Market ended: marketId={}, from={}, endTime={}", market.getId(), current, market.getEndTime());
        }
        return changed;
    }

    /**
     * Return every stake of an ended market.
     */
    public EngineResult<SettlementSummary> refund(String marketId, String actor) {
        return withMarket(marketId, market -> {
            EngineResult<SettlementEngine.Finalization> result = lockRegistry.executeWithLock(marketId, () -> {
                closeIfExpired(market);
                return settlementEngine.finalizeLocked(market, MarketStatus.ENDED, MarketStatus.REFUNDED, null,
                        ResolutionMethod.ADMIN_DECISION, actor, voteStore.forMarket(marketId).size());
            });
            return published(result);
        });
    }

    /**
     * Abort a non-terminal market and return every stake.
     */
    public EngineResult<SettlementSummary> cancel(String marketId, String actor) {
        return withMarket(marketId, market -> {
            EngineResult<SettlementEngine.Finalization> result = lockRegistry.executeWithLock(marketId,
                    () -> settlementEngine.finalizeLocked(market, market.getStatus(), MarketStatus.CANCELLED, null,
                            ResolutionMethod.ADMIN_DECISION, actor, voteStore.forMarket(marketId).size()));
            return published(result);
        });
    }

    /**
     * Ends markets past their end time and auto-refunds ended markets whose
     * resolution deadline passed. Ended markets that already have a stored
     * resolution are settled to complete their interrupted finalization.
     * Settled markets are dropped from memory once fully written.
     * Busy markets are retried on the next run.
     */
    @Scheduled(fixedDelayString = "${amm.sweep-interval-ms:5000}")
    public void sweep() {
        Instant now = clock.instant();
        for (Market market : marketStore.snapshot()) {
            try {
                sweepMarket(market, now);
            } catch (InvariantViolationException e) {
                // Already halted and logged where it was detected
                log.warn("Sweep skipped halted market: marketId={}", market.getId());
            } catch (RuntimeException e) {
                log.warn("Sweep failed for market, retrying next run: marketId={}", market.getId(), e);
            }
        }
    }

    private void sweepMarket(Market market, Instant now) {
        MarketStatus status = market.getStatus();
        if (status.isTerminal()) {
            if (market.isSettled()) {
                evictSettled(market);
            }
            return;
        }

        if ((status == MarketStatus.ACTIVE || status == MarketStatus.PAUSED) && market.hasEndTimePassed(now)) {
            EngineResult<Boolean> ended = lockRegistry.executeWithLock(market.getId(),
                    () -> EngineResult.success(closeIfExpired(market)));
            if (ended.isFailure()) {
                log.warn("Sweep could not end market: marketId={}, code={}", market.getId(), ended.getError().getCode());
                return;
            }
        }
        if (market.getStatus() != MarketStatus.ENDED) {
            return;
        }

        if (settlementStore.findResolution(market.getId()).isPresent()) {
            EngineResult<SettlementSummary> completed = settlementEngine.settle(market.getId());
            if (completed.isFailure()) {
                log.warn("Interrupted finalization deferred: marketId={}, code={}",
                        market.getId(), completed.getError().getCode());
            }
            return;
        }

        if (market.hasResolutionDeadlinePassed(now)) {
            EngineResult<SettlementSummary> refunded = settlementEngine.finalizeMarket(market, MarketStatus.ENDED,
                    MarketStatus.REFUNDED, null, ResolutionMethod.AUTO_REFUND, SYSTEM_ACTOR,
                    voteStore.forMarket(market.getId()).size());
            if (refunded.isFailure()) {
                log.warn("Auto-refund deferred: marketId={}, code={}", market.getId(), refunded.getError().getCode());
            } else {
                log.info("Market auto-refunded: marketId={}, deadline={}", market.getId(), market.getResolutionDeadline());
            }
        }
    }

    /**
     * Drop a settled market's hot state. Everything must already be written;
     * later reads load it back from storage.
     */
    private void evictSettled(Market market) {
        String marketId = market.getId();
        EngineResult<Boolean> evicted = lockRegistry.executeWithLock(marketId, () -> {
            if (marketStore.isDirty(marketId) || positionStore.hasDirty(marketId)
                    || settlementStore.hasPendingWrites(marketId)) {
                return EngineResult.success(false);
            }
            boolean dropped = positionStore.evict(marketId) && voteStore.evict(marketId)
                    && settlementStore.evict(marketId) && marketStore.evict(marketId);
            return EngineResult.success(dropped);
        });
        if (evicted.isSuccess() && evicted.getValue()) {
            log.debug("Evicted settled market: marketId={}, status={}", marketId, market.getStatus());
        }
    }

    private EngineResult<Market> transition(String marketId, Set<MarketStatus> from, MarketStatus to) {
        return withMarket(marketId, market -> lockRegistry.executeWithLock(marketId,
                () -> transitionLocked(market, from, to)));
    }

    private EngineResult<Market> transitionLocked(Market market, Set<MarketStatus> from, MarketStatus to) {
        MarketStatus current = market.getStatus();
        if (!from.contains(current) || !current.canTransitionTo(to)) {
            return EngineResult.failure(ErrorCode.INVALID_TRANSITION,
                    String.format("Cannot move market %s from %s to %s", market.getId(), current, to));
        }
        market.compareAndTransition(current, to, clock.instant());
        marketStore.markDirty(market);
        log.info("Market status changed: marketId={}, from={}, to={}", market.getId(), current, to);
        return EngineResult.success(market);
    }

    private EngineResult<SettlementSummary> published(EngineResult<SettlementEngine.Finalization> result) {
        if (result.isFailure()) {
            return result.propagate();
        }
        settlementEngine.publish(result.getValue());
        return EngineResult.success(result.getValue().getSummary());
    }

    private <T> EngineResult<T> withMarket(String marketId, Function<Market, EngineResult<T>> action) {
        Optional<Market> market = marketStore.find(marketId);
        if (market.isEmpty()) {
            return EngineResult.failure(ErrorCode.MARKET_NOT_FOUND, "Market not found: " + marketId);
        }
        return action.apply(market.get());
    }

    private static <T> EngineResult<T> invalid(String message) {
        return EngineResult.failure(ErrorCode.INVALID_MARKET, message);
    }
}
