package com.prediction.market.amm.service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.prediction.market.amm.cache.MarketStore;
import com.prediction.market.amm.cache.PositionStore;
import com.prediction.market.amm.cache.SettlementStore;
import com.prediction.market.amm.engine.PricingEngine;
import com.prediction.market.amm.entity.Market;
import com.prediction.market.amm.entity.OutcomePool;
import com.prediction.market.amm.entity.Payout;
import com.prediction.market.amm.entity.Position;
import com.prediction.market.amm.entity.Resolution;
import com.prediction.market.amm.entity.TradeQuote;
import com.prediction.market.amm.execution.MarketLockRegistry;
import com.prediction.market.amm.result.EngineResult;
import com.prediction.market.amm.result.ErrorCode;

import lombok.RequiredArgsConstructor;

/**
 * Read side. Quotes and snapshots are taken under the market lock so the
 * two reserves of a pool are never read mid-trade.
 */
@Service
@RequiredArgsConstructor
public class MarketQueryService {

    private final MarketStore marketStore;
    private final PositionStore positionStore;
    private final SettlementStore settlementStore;
    private final PricingEngine pricingEngine;
    private final MarketLockRegistry lockRegistry;

    public EngineResult<TradeQuote> getQuote(String marketId, String outcome, BigDecimal amount) {
        Optional<Market> found = marketStore.find(marketId);
        if (found.isEmpty()) {
            return notFound(marketId);
        }
        Market market = found.get();
        return lockRegistry.executeWithLock(marketId, () -> {
            if (market.getStatus().isTerminal()) {
                return EngineResult.failure(ErrorCode.MARKET_NOT_ACTIVE,
                        String.format("Market %s is %s", marketId, market.getStatus()));
            }
            Optional<String> canonical = market.canonicalOutcome(outcome);
            if (canonical.isEmpty()) {
                return EngineResult.failure(ErrorCode.INVALID_OUTCOME,
                        String.format("Unknown outcome '%s', expected one of %s", outcome, market.getOutcomes()));
            }
            return market.pool(canonical.get()).quoteBuy(amount);
        });
    }

    public EngineResult<MarketSnapshot> getMarketState(String marketId) {
        Optional<Market> found = marketStore.find(marketId);
        if (found.isEmpty()) {
            return notFound(marketId);
        }
        Market market = found.get();
        return lockRegistry.executeWithLock(marketId, () -> EngineResult.success(snapshot(market)));
    }

    /**
     * Positions of a market, optionally only those of one user.
     */
    public EngineResult<List<Position>> getPositions(String marketId, String userId) {
        if (marketStore.find(marketId).isEmpty()) {
            return notFound(marketId);
        }
        List<Position> positions = userId == null
                ? new ArrayList<>(positionStore.forMarket(marketId))
                : positionStore.forUser(marketId, userId);
        return EngineResult.success(positions);
    }

    public EngineResult<Resolution> getResolution(String marketId) {
        if (marketStore.find(marketId).isEmpty()) {
            return notFound(marketId);
        }
        return settlementStore.findResolution(marketId)
                .map(EngineResult::success)
                .orElseGet(() -> EngineResult.failure(ErrorCode.RESOLUTION_NOT_FOUND,
                        "Market has no resolution yet: " + marketId));
    }

    public EngineResult<List<Payout>> getPayouts(String marketId) {
        if (marketStore.find(marketId).isEmpty()) {
            return notFound(marketId);
        }
        return EngineResult.success(settlementStore.payoutsFor(marketId));
    }

    private MarketSnapshot snapshot(Market market) {
        Map<String, BigDecimal> prices = pricingEngine.impliedPrices(market);
        List<OutcomeSnapshot> outcomes = new ArrayList<>(market.getPools().size());
        for (OutcomePool pool : market.getPools()) {
            outcomes.add(OutcomeSnapshot.builder()
                    .outcome(pool.getOutcome())
                    .shareReserve(pool.getShareReserve())
                    .cashReserve(pool.getCashReserve())
                    .k(pool.getK())
                    .impliedPrice(prices.get(pool.getOutcome()))
                    .totalVolume(pool.getTotalVolume())
                    .tradeCount(pool.getTradeCount())
                    .build());
        }
        return MarketSnapshot.builder()
                .marketId(market.getId())
                .question(market.getQuestion())
                .description(market.getDescription())
                .status(market.getStatus())
                .outcomes(outcomes)
                .priceNormalization(pricingEngine.getNormalization())
                .totalVolume(market.getTotalVolume())
                .totalTrades(market.getTotalTrades())
                .endTime(market.getEndTime())
                .resolutionDeadline(market.getResolutionDeadline())
                .winningOutcome(market.getWinningOutcome())
                .haltReason(market.getHaltReason())
                .settlementCompletedAt(market.getSettlementCompletedAt())
                .build();
    }

    private static <T> EngineResult<T> notFound(String marketId) {
        return EngineResult.failure(ErrorCode.MARKET_NOT_FOUND, "Market not found: " + marketId);
    }
}
