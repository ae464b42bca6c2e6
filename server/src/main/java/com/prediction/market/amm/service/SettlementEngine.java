package com.prediction.market.amm.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.prediction.market.amm.cache.MarketStore;
import com.prediction.market.amm.cache.PositionStore;
import com.prediction.market.amm.cache.SettlementStore;
import com.prediction.market.amm.config.AmmProperties;
import com.prediction.market.amm.engine.PayoutModel;
import com.prediction.market.amm.entity.FixedPoint;
import com.prediction.market.amm.entity.Market;
import com.prediction.market.amm.entity.MarketStatus;
import com.prediction.market.amm.entity.Payout;
import com.prediction.market.amm.entity.PayoutKind;
import com.prediction.market.amm.entity.Position;
import com.prediction.market.amm.entity.Resolution;
import com.prediction.market.amm.entity.ResolutionMethod;
import com.prediction.market.amm.event.EngineEventPublisher;
import com.prediction.market.amm.execution.MarketLockRegistry;
import com.prediction.market.amm.result.EngineResult;
import com.prediction.market.amm.result.ErrorCode;
import com.prediction.market.amm.result.InvariantViolationException;

import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * Takes markets to a terminal status and pays their positions.
 *
 * CRITICAL PROPERTIES:
 * - Atomic: the whole payout plan is computed before any position changes,
 *   then status, resolution and payouts are applied under one lock scope
 * - Idempotent: only OPEN positions without a stored payout are paid, a re-run
 *   pays nothing twice, even after a crash between the payout and position writes
 * - Recoverable: a market left non-terminal next to a stored resolution is
 *   moved to the resolution's status by {@link #settle}
 * - Conserving: total net payouts never exceed the pool minus the house edge
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SettlementEngine {

    private final MarketStore marketStore;
    private final PositionStore positionStore;
    private final SettlementStore settlementStore;
    private final MarketLockRegistry lockRegistry;
    private final EngineEventPublisher eventPublisher;
    private final AmmProperties properties;
    private final Clock clock;

    /**
     * Result of a terminal transition, handed back so events go out after the lock is released.
     */
    @Value
    static class Finalization {
        Resolution resolution;
        SettlementSummary summary;
        List<Payout> newPayouts;
        List<String> userIds;
    }

    @Value
    private static class PlannedPayout {
        Position position;
        PayoutKind kind;
        BigDecimal gross;
        BigDecimal fee;
        BigDecimal net;
    }

    /**
     * OPEN position whose payout is already stored.
     */
    @Value
    private static class PaidPosition {
        Position position;
        Payout payout;
    }

    @Value
    private static class SettlementPlan {
        List<PlannedPayout> payouts;
        List<Position> losers;
        List<PaidPosition> alreadyPaid;
        BigDecimal totalPool;
        BigDecimal totalWinningStake;

        int positionsClosed() {
            return payouts.size() + losers.size() + alreadyPaid.size();
        }
    }

    /**
     * Move the market from {@code expected} to the terminal status and settle it,
     * taking the market lock. Events are published before returning.
     */
    public EngineResult<SettlementSummary> finalizeMarket(Market market, MarketStatus expected, MarketStatus terminal,
            String winningOutcome, ResolutionMethod method, String resolvedBy, int voteCount) {
        EngineResult<Finalization> result = lockRegistry.executeWithLock(market.getId(),
                () -> finalizeLocked(market, expected, terminal, winningOutcome, method, resolvedBy, voteCount));
        if (result.isFailure()) {
            return result.propagate();
        }
        publish(result.getValue());
        return EngineResult.success(result.getValue().getSummary());
    }

    /**
     * Same as {@link #finalizeMarket} for callers already holding the market lock.
     * The caller publishes the returned finalization once the lock is released.
     */
    EngineResult<Finalization> finalizeLocked(Market market, MarketStatus expected, MarketStatus terminal,
            String winningOutcome, ResolutionMethod method, String resolvedBy, int voteCount) {
        if (!terminal.isTerminal() || !expected.canTransitionTo(terminal)) {
            return EngineResult.failure(ErrorCode.INVALID_TRANSITION,
                    String.format("Cannot move market %s from %s to %s", market.getId(), expected, terminal));
        }
        if (market.getStatus() != expected) {
            return EngineResult.failure(ErrorCode.INVALID_TRANSITION,
                    String.format("Market %s is %s, expected %s", market.getId(), market.getStatus(), expected));
        }
        if (settlementStore.findResolution(market.getId()).isPresent()) {
            return EngineResult.failure(ErrorCode.INVALID_TRANSITION,
                    "Market already has a resolution, settle it to complete: " + market.getId());
        }

        Instant now = clock.instant();
        List<Position> positions = positionStore.forMarket(market.getId());
        SettlementPlan plan = plan(market, terminal, winningOutcome, positions);
        checkConservation(market, plan.getPayouts(), plan.getTotalPool(), now);

        market.compareAndTransition(expected, terminal, now);
        if (terminal == MarketStatus.RESOLVED) {
            market.recordWinner(winningOutcome);
        }

        BigDecimal fees = FixedPoint.sum(plan.getPayouts().stream().map(PlannedPayout::getFee)
                .collect(Collectors.toList()));
        BigDecimal net = FixedPoint.sum(plan.getPayouts().stream().map(PlannedPayout::getNet)
                .collect(Collectors.toList()));

        Resolution resolution = Resolution.builder()
                .marketId(market.getId())
                .winningOutcome(terminal == MarketStatus.RESOLVED ? winningOutcome : null)
                .finalStatus(terminal)
                .method(method)
                .resolvedBy(resolvedBy)
                .resolvedAt(now)
                .voteCount(voteCount)
                .totalPool(plan.getTotalPool())
                .totalWinningStake(plan.getTotalWinningStake())
                .totalLosingStake(terminal == MarketStatus.RESOLVED
                        ? FixedPoint.subtract(plan.getTotalPool(), plan.getTotalWinningStake())
                        : FixedPoint.ZERO)
                .houseEdgeBps(terminal == MarketStatus.RESOLVED ? properties.getHouseEdgeBps() : 0)
                .houseEdgeAmount(fees)
                .totalPayouts(net)
                .disputeDeadline(terminal == MarketStatus.RESOLVED ? now.plus(properties.getDisputeWindow()) : null)
                .build();
        settlementStore.recordResolution(resolution);

        List<Payout> newPayouts = apply(market, plan, now);
        SettlementSummary summary = summarize(market, positions, plan.positionsClosed());

        log.info("Market finalized: marketId={}, status={}, method={}, winner={}, totalPool={}, totalPayouts={}, houseEdge={}",
                market.getId(), terminal, method, winningOutcome, plan.getTotalPool().toPlainString(),
                net.toPlainString(), fees.toPlainString());

        List<String> userIds = positions.stream().map(Position::getUserId).distinct().collect(Collectors.toList());
        return EngineResult.success(new Finalization(resolution, summary, newPayouts, userIds));
    }

    /**
     * Settle every OPEN position of a terminal market. Safe to call any number
     * of times: a settled market returns the same totals and changes nothing.
     *
     * A non-terminal market with a stored resolution was interrupted between
     * recording the resolution and writing its status; it is moved to the
     * resolution's status first and the resolution event is published again.
     */
    public EngineResult<SettlementSummary> settle(String marketId) {
        Optional<Market> found = marketStore.find(marketId);
        if (found.isEmpty()) {
            return EngineResult.failure(ErrorCode.MARKET_NOT_FOUND, "Market not found: " + marketId);
        }
        Market market = found.get();

        EngineResult<Finalization> result = lockRegistry.executeWithLock(marketId, () -> {
            Instant now = clock.instant();
            Resolution restored = null;
            if (!market.getStatus().isTerminal()) {
                Optional<Resolution> stored = settlementStore.findResolution(marketId);
                if (stored.isEmpty()) {
                    return EngineResult.failure(ErrorCode.NOT_SETTLEABLE,
                            String.format("Market %s is %s, not terminal", marketId, market.getStatus()));
                }
                restored = stored.get();
                restoreTerminalStatus(market, restored, now);
            }

            List<Position> positions = positionStore.forMarket(marketId);
            SettlementPlan plan = plan(market, market.getStatus(), market.getWinningOutcome(), positions);
            checkConservation(market, plan.getPayouts(), plan.getTotalPool(), now);

            List<Payout> newPayouts = apply(market, plan, now);
            SettlementSummary summary = summarize(market, positions, plan.positionsClosed());
            if (summary.getPositionsSettled() > 0) {
                log.info("Settlement completed: marketId={}, positionsSettled={}, totalPayouts={}",
                        marketId, summary.getPositionsSettled(), summary.getTotalPayouts().toPlainString());
            }
            List<String> userIds = restored == null
                    ? List.of()
                    : positions.stream().map(Position::getUserId).distinct().collect(Collectors.toList());
            return EngineResult.success(new Finalization(restored, summary, newPayouts, userIds));
        });

        if (result.isFailure()) {
            return result.propagate();
        }
        Finalization finalization = result.getValue();
        if (finalization.getResolution() != null) {
            publish(finalization);
        } else {
            eventPublisher.publishPayoutReady(marketId, finalization.getNewPayouts());
        }
        return EngineResult.success(finalization.getSummary());
    }

    private void restoreTerminalStatus(Market market, Resolution resolution, Instant now) {
        MarketStatus from = market.getStatus();
        MarketStatus target = resolution.getFinalStatus();
        if (!from.canTransitionTo(target)) {
            // RESOLVED and REFUNDED are only reachable from ENDED
            market.compareAndTransition(from, MarketStatus.ENDED, now);
        }
        market.compareAndTransition(market.getStatus(), target, now);
        if (target == MarketStatus.RESOLVED) {
            market.recordWinner(resolution.getWinningOutcome());
        }
        log.warn("Market status restored from stored resolution: marketId={}, from={}, to={}",
                market.getId(), from, target);
    }

    void publish(Finalization finalization) {
        eventPublisher.publishMarketResolved(finalization.getResolution(), finalization.getUserIds());
        eventPublisher.publishPayoutReady(finalization.getResolution().getMarketId(), finalization.getNewPayouts());
    }

    // ===== Planning (pure) =====

    private SettlementPlan plan(Market market, MarketStatus status, String winningOutcome, List<Position> positions) {
        BigDecimal totalPool = FixedPoint.sum(positions.stream().map(Position::getAmountPaid)
                .collect(Collectors.toList()));
        List<PlannedPayout> payouts = new ArrayList<>();
        List<Position> losers = new ArrayList<>();
        List<PaidPosition> alreadyPaid = new ArrayList<>();
        Map<String, Payout> paid = settlementStore.payoutsFor(market.getId()).stream()
                .collect(Collectors.toMap(Payout::getPositionId, Function.identity(), (first, second) -> first));

        if (status.isRefundLike()) {
            for (Position position : positions) {
                if (!position.isOpen()) {
                    continue;
                }
                Payout existing = paid.get(position.getId());
                if (existing != null) {
                    alreadyPaid.add(new PaidPosition(position, existing));
                } else {
                    payouts.add(new PlannedPayout(position, PayoutKind.REFUND, position.getAmountPaid(),
                            FixedPoint.ZERO, position.getAmountPaid()));
                }
            }
            return new SettlementPlan(payouts, losers, alreadyPaid, totalPool, FixedPoint.ZERO);
        }

        List<Position> winners = positions.stream()
                .filter(p -> p.getOutcome().equals(winningOutcome))
                .collect(Collectors.toList());
        BigDecimal winningStake = FixedPoint.sum(winners.stream().map(Position::getAmountPaid)
                .collect(Collectors.toList()));
        List<BigDecimal> grosses = grossPayouts(winners, totalPool);

        for (int i = 0; i < winners.size(); i++) {
            Position winner = winners.get(i);
            if (!winner.isOpen()) {
                continue;
            }
            Payout existing = paid.get(winner.getId());
            if (existing != null) {
                alreadyPaid.add(new PaidPosition(winner, existing));
                continue;
            }
            BigDecimal gross = grosses.get(i);
            BigDecimal fee = FixedPoint.basisPoints(gross, properties.getHouseEdgeBps());
            payouts.add(new PlannedPayout(winner, PayoutKind.WINNING, gross, fee, FixedPoint.subtract(gross, fee)));
        }
        for (Position position : positions) {
            if (position.isOpen() && !position.getOutcome().equals(winningOutcome)) {
                losers.add(position);
            }
        }
        return new SettlementPlan(payouts, losers, alreadyPaid, totalPool, winningStake);
    }

    /**
     * Gross payout of every winning position (settled or not), in placement order.
     */
    private List<BigDecimal> grossPayouts(List<Position> winners, BigDecimal totalPool) {
        List<BigDecimal> grosses = new ArrayList<>(winners.size());
        if (properties.getPayoutModel() == PayoutModel.PAR_VALUE) {
            winners.forEach(w -> grosses.add(FixedPoint.normalize(w.getSharesAcquired())));
            return grosses;
        }

        BigDecimal winningShares = FixedPoint.sum(winners.stream().map(Position::getSharesAcquired)
                .collect(Collectors.toList()));
        BigDecimal allocated = FixedPoint.ZERO;
        for (int i = 0; i < winners.size(); i++) {
            BigDecimal gross;
            if (i == winners.size() - 1) {
                // Last winner takes the rounding dust
                gross = FixedPoint.subtract(totalPool, allocated);
            } else {
                gross = FixedPoint.divideDown(
                        FixedPoint.product(totalPool, winners.get(i).getSharesAcquired()), winningShares);
            }
            allocated = FixedPoint.add(allocated, gross);
            grosses.add(gross);
        }
        return grosses;
    }

    private void checkConservation(Market market, List<PlannedPayout> planned, BigDecimal totalPool, Instant now) {
        List<BigDecimal> nets = new ArrayList<>();
        List<BigDecimal> fees = new ArrayList<>();
        for (Payout existing : settlementStore.payoutsFor(market.getId())) {
            nets.add(existing.getNetAmount());
            fees.add(existing.getFee());
        }
        for (PlannedPayout p : planned) {
            nets.add(p.getNet());
            fees.add(p.getFee());
        }
        BigDecimal totalNet = FixedPoint.sum(nets);
        BigDecimal limit = FixedPoint.subtract(totalPool, FixedPoint.sum(fees));
        if (totalNet.compareTo(limit) > 0) {
            String reason = String.format("payouts %s exceed pool %s minus house edge",
                    totalNet.toPlainString(), totalPool.toPlainString());
            market.halt(reason, now);
            marketStore.persistNow(market);
            log.error("Market halted: marketId={}, reason={}", market.getId(), reason);
            throw new InvariantViolationException(market.getId(), reason);
        }
    }

    // ===== Application =====

    private List<Payout> apply(Market market, SettlementPlan plan, Instant now) {
        List<Payout> created = new ArrayList<>(plan.getPayouts().size());
        List<Position> closing = new ArrayList<>();
        plan.getPayouts().forEach(planned -> closing.add(planned.getPosition()));
        closing.addAll(plan.getLosers());
        plan.getAlreadyPaid().forEach(paid -> closing.add(paid.getPosition()));
        // Positions are written as closed only once their payouts are stored
        positionStore.withhold(closing);

        for (PlannedPayout planned : plan.getPayouts()) {
            Position position = planned.getPosition();
            if (planned.getKind() == PayoutKind.REFUND) {
                position.voidWithRefund(now);
            } else {
                position.settle(planned.getNet(), now);
            }
            created.add(Payout.builder()
                    .id(UUID.randomUUID().toString())
                    .marketId(market.getId())
                    .positionId(position.getId())
                    .userId(position.getUserId())
                    .outcome(position.getOutcome())
                    .kind(planned.getKind())
                    .amountPaid(position.getAmountPaid())
                    .sharesAcquired(position.getSharesAcquired())
                    .grossAmount(planned.getGross())
                    .fee(planned.getFee())
                    .netAmount(planned.getNet())
                    .profitLoss(FixedPoint.subtract(planned.getNet(), position.getAmountPaid()))
                    .createdAt(now)
                    .build());
        }
        for (Position loser : plan.getLosers()) {
            loser.settle(FixedPoint.ZERO, now);
        }
        for (PaidPosition paid : plan.getAlreadyPaid()) {
            Position position = paid.getPosition();
            if (paid.getPayout().getKind() == PayoutKind.REFUND) {
                position.voidWithRefund(now);
            } else {
                position.settle(paid.getPayout().getNetAmount(), now);
            }
        }
        if (!plan.getAlreadyPaid().isEmpty()) {
            log.warn("Closed positions whose payouts were already stored: marketId={}, count={}",
                    market.getId(), plan.getAlreadyPaid().size());
        }

        boolean payoutsStored = settlementStore.recordPayouts(market.getId(), created,
                () -> positionStore.release(closing));
        if (payoutsStored) {
            positionStore.flushMarket(market.getId());
        }
        market.markSettled(now);
        marketStore.persistNow(market);
        return created;
    }

    private SettlementSummary summarize(Market market, List<Position> positions, int positionsSettled) {
        List<Payout> payouts = settlementStore.payoutsFor(market.getId());
        return SettlementSummary.builder()
                .marketId(market.getId())
                .status(market.getStatus())
                .winningOutcome(market.getWinningOutcome())
                .totalPool(FixedPoint.sum(positions.stream().map(Position::getAmountPaid)
                        .collect(Collectors.toList())))
                .totalGross(FixedPoint.sum(payouts.stream().map(Payout::getGrossAmount)
                        .collect(Collectors.toList())))
                .houseEdgeAmount(FixedPoint.sum(payouts.stream().map(Payout::getFee)
                        .collect(Collectors.toList())))
                .totalPayouts(FixedPoint.sum(payouts.stream().map(Payout::getNetAmount)
                        .collect(Collectors.toList())))
                .payoutCount(payouts.size())
                .positionsSettled(positionsSettled)
                .settledAt(market.getSettlementCompletedAt())
                .build();
    }
}
