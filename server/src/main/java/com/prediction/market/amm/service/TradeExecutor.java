package com.prediction.market.amm.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import org.springframework.stereotype.Service;

import com.prediction.market.amm.cache.MarketStore;
import com.prediction.market.amm.cache.PositionStore;
import com.prediction.market.amm.entity.Market;
import com.prediction.market.amm.entity.OutcomePool;
import com.prediction.market.amm.entity.Position;
import com.prediction.market.amm.entity.TradeQuote;
import com.prediction.market.amm.event.EngineEventPublisher;
import com.prediction.market.amm.execution.MarketLockRegistry;
import com.prediction.market.amm.result.EngineResult;
import com.prediction.market.amm.result.ErrorCode;
import com.prediction.market.amm.result.InvariantViolationException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Bet execution - the only writer of pool reserves.
 *
 * Flow:
 * 1. Look up the market, pre-validate (BetValidator)
 * 2. Take the market lock (bounded wait, MARKET_BUSY on timeout)
 * 3. Re-validate under the lock
 * 4. Quote and apply on the selected pool only
 * 5. Bump market totals, append the Position, mark state dirty
 * 6. Release the lock, publish TradeExecutedEvent
 *
 * Bets on one market apply in lock-acquisition order, so concurrent bets
 * end in the same state as replaying them sequentially in position order.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradeExecutor {

    private final MarketStore marketStore;
    private final PositionStore positionStore;
    private final MarketLockRegistry lockRegistry;
    private final BetValidator betValidator;
    private final EngineEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * Place a bet of {@code amount} on {@code outcome}.
     *
     * @throws InvariantViolationException if the pool is found off its curve;
     *         the market is halted before the exception propagates
     */
    public EngineResult<Position> placeBet(String marketId, String outcome, BigDecimal amount, String bettorId) {
        Optional<Market> found = marketStore.find(marketId);
        if (found.isEmpty()) {
            return EngineResult.failure(ErrorCode.MARKET_NOT_FOUND, "Market not found: " + marketId);
        }
        Market market = found.get();

        EngineResult<String> precheck = betValidator.validate(market, outcome, amount, bettorId, clock.instant());
        if (precheck.isFailure()) {
            log.warn("Bet rejected: marketId={}, userId={}, code={}, reason={}",
                    marketId, bettorId, precheck.getError().getCode(), precheck.getError().getMessage());
            return precheck.propagate();
        }

        EngineResult<Position> result = lockRegistry.executeWithLock(marketId,
                () -> executeLocked(market, outcome, amount, bettorId));

        if (result.isSuccess()) {
            eventPublisher.publishTradeExecuted(result.getValue());
        } else {
            log.warn("Bet rejected: marketId={}, userId={}, code={}, reason={}",
                    marketId, bettorId, result.getError().getCode(), result.getError().getMessage());
        }
        return result;
    }

    private EngineResult<Position> executeLocked(Market market, String outcome, BigDecimal amount, String bettorId) {
        Instant now = clock.instant();

        // State may have changed while waiting for the lock
        EngineResult<String> validation = betValidator.validate(market, outcome, amount, bettorId, now);
        if (validation.isFailure()) {
            return validation.propagate();
        }
        String canonicalOutcome = validation.getValue();
        OutcomePool pool = market.pool(canonicalOutcome);

        EngineResult<TradeQuote> applied;
        try {
            applied = pool.applyBuy(amount);
        } catch (InvariantViolationException e) {
            market.halt(e.getMessage(), now);
            marketStore.persistNow(market);
            log.error("Market halted: marketId={}, reason={}", market.getId(), e.getMessage(), e);
            throw e;
        }
        if (applied.isFailure()) {
            return applied.propagate();
        }

        TradeQuote quote = applied.getValue();
        market.recordTrade(quote.getCashIn(), now);

        Position position = Position.builder()
                .id(UUID.randomUUID().toString())
                .marketId(market.getId())
                .userId(bettorId)
                .outcome(canonicalOutcome)
                .amountPaid(quote.getCashIn())
                .sharesAcquired(quote.getSharesOut())
                .avgPricePerShare(quote.getAvgPricePerShare())
                .placedAt(now)
                .build();

        positionStore.append(position);
        marketStore.markDirty(market);

        log.info("Trade executed: marketId={}, userId={}, outcome={}, cashIn={}, sharesOut={}, priceAfter={}",
                market.getId(), bettorId, canonicalOutcome, quote.getCashIn().toPlainString(),
                quote.getSharesOut().toPlainString(), quote.getPriceAfter().toPlainString());

        return EngineResult.success(position);
    }
}
