package com.prediction.market.amm.entity;

import java.math.BigDecimal;

import com.prediction.market.amm.result.EngineResult;
import com.prediction.market.amm.result.ErrorCode;
import com.prediction.market.amm.result.InvariantViolationException;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Constant-product bonding curve for one outcome of one market.
 *
 * Invariant: {@code shareReserve * cashReserve == k} up to one rounding unit,
 * where {@code k = initialLiquidity^2} is fixed when the pool is seeded.
 * Buying moves cash into the pool and shares out of it, so the implied price
 * {@code cash / (cash + share)} rises with every buy.
 *
 * Mutated only by {@link #applyBuy(BigDecimal)}, which callers must invoke
 * while holding the owning market's execution lock.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class OutcomePool {

    private String marketId;
    private String outcome;
    private BigDecimal initialLiquidity;
    private BigDecimal k;
    private BigDecimal shareReserve;
    private BigDecimal cashReserve;

    @Builder.Default
    private BigDecimal totalVolume = FixedPoint.ZERO;

    @Builder.Default
    private long tradeCount = 0;

    /**
     * New pool with both reserves equal to the seed liquidity.
     */
    public static OutcomePool seed(String marketId, String outcome, BigDecimal initialLiquidity) {
        if (!FixedPoint.isPositive(initialLiquidity)) {
            throw new IllegalArgumentException("Initial liquidity must be positive");
        }
        BigDecimal liquidity = FixedPoint.normalize(initialLiquidity);
        return OutcomePool.builder()
                .marketId(marketId)
                .outcome(outcome)
                .initialLiquidity(liquidity)
                .k(FixedPoint.product(liquidity, liquidity))
                .shareReserve(liquidity)
                .cashReserve(liquidity)
                .build();
    }

    /**
     * Price a buy of {@code cashIn} without mutating the pool.
     */
    public EngineResult<TradeQuote> quoteBuy(BigDecimal cashIn) {
        if (cashIn == null || cashIn.signum() <= 0) {
            return EngineResult.failure(ErrorCode.INVALID_AMOUNT, "Amount must be positive");
        }
        if (!FixedPoint.fitsScale(cashIn)) {
            return EngineResult.failure(ErrorCode.INVALID_AMOUNT,
                    String.format("Amount supports at most %d decimal places", FixedPoint.SCALE));
        }

        BigDecimal newCashReserve = FixedPoint.add(cashReserve, cashIn);
        // Rounded up: the pool keeps the rounding unit, the buyer never gets it
        BigDecimal newShareReserve = FixedPoint.divideUp(k, newCashReserve);
        BigDecimal sharesOut = FixedPoint.subtract(shareReserve, newShareReserve);

        if (sharesOut.signum() <= 0) {
            return EngineResult.failure(ErrorCode.INVALID_AMOUNT,
                    "Amount " + cashIn.toPlainString() + " is too small to buy any shares of " + outcome);
        }

        return EngineResult.success(TradeQuote.builder()
                .outcome(outcome)
                .cashIn(FixedPoint.normalize(cashIn))
                .sharesOut(sharesOut)
                .avgPricePerShare(FixedPoint.divide(cashIn, sharesOut))
                .priceBefore(impliedPrice())
                .priceAfter(price(newCashReserve, newShareReserve))
                .newCashReserve(newCashReserve)
                .newShareReserve(newShareReserve)
                .build());
    }

    /**
     * Execute a buy: move the reserves to the quoted point on the curve.
     *
     * @throws InvariantViolationException if the reserves are off the curve
     *         before the trade, or would be after it. The pool is left untouched.
     */
    public EngineResult<TradeQuote> applyBuy(BigDecimal cashIn) {
        requireOnCurve(shareReserve, cashReserve, "before trade");

        EngineResult<TradeQuote> quote = quoteBuy(cashIn);
        if (quote.isFailure()) {
            return quote;
        }

        TradeQuote q = quote.getValue();
        requireOnCurve(q.getNewShareReserve(), q.getNewCashReserve(), "after trade");

        this.cashReserve = q.getNewCashReserve();
        this.shareReserve = q.getNewShareReserve();
        this.totalVolume = FixedPoint.add(totalVolume, q.getCashIn());
        this.tradeCount++;
        return quote;
    }

    public BigDecimal impliedPrice() {
        return price(cashReserve, shareReserve);
    }

    /**
     * True when {@code 0 <= share * cash - k <= cash * UNIT}.
     * Ceiling division can only leave the product above k, and by less than
     * one share unit times the cash reserve.
     */
    public boolean isOnCurve(BigDecimal share, BigDecimal cash) {
        BigDecimal deviation = FixedPoint.product(share, cash).subtract(k);
        BigDecimal tolerance = FixedPoint.product(cash, FixedPoint.UNIT);
        return deviation.signum() >= 0 && deviation.compareTo(tolerance) <= 0;
    }

    private void requireOnCurve(BigDecimal share, BigDecimal cash, String stage) {
        if (share.signum() <= 0 || cash.signum() <= 0 || !isOnCurve(share, cash)) {
            throw new InvariantViolationException(marketId, String.format(
                    "pool %s off curve %s: share=%s cash=%s k=%s",
                    outcome, stage, share.toPlainString(), cash.toPlainString(), k.toPlainString()));
        }
    }

    private static BigDecimal price(BigDecimal cash, BigDecimal share) {
        return FixedPoint.divide(cash, cash.add(share));
    }
}
