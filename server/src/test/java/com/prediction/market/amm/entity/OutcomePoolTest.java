package com.prediction.market.amm.entity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.prediction.market.amm.result.EngineResult;
import com.prediction.market.amm.result.ErrorCode;
import com.prediction.market.amm.result.InvariantViolationException;

class OutcomePoolTest {

    private OutcomePool pool;

    @BeforeEach
    void setUp() {
        pool = OutcomePool.seed("m-1", "Yes", new BigDecimal("30000"));
    }

    @Test
    @DisplayName("Seeding sets both reserves to the liquidity and k to its square")
    void seed() {
        assertThat(pool.getK()).isEqualByComparingTo("900000000");
        assertThat(pool.getShareReserve()).isEqualByComparingTo("30000");
        assertThat(pool.getCashReserve()).isEqualByComparingTo("30000");
        assertThat(pool.impliedPrice()).isEqualByComparingTo("0.5");
    }

    @Nested
    @DisplayName("quoteBuy")
    class QuoteBuy {

        @Test
        @DisplayName("1000 into a 30000 pool buys 967.74193548 shares and lifts the price to 0.5164")
        void buyingIntoFreshPoolMovesPrice() {
            TradeQuote quote = pool.quoteBuy(new BigDecimal("1000")).getValue();

            assertThat(quote.getSharesOut()).isEqualByComparingTo("967.74193548");
            assertThat(quote.getNewShareReserve()).isEqualByComparingTo("29032.25806452");
            assertThat(quote.getNewCashReserve()).isEqualByComparingTo("31000");
            assertThat(quote.getPriceBefore()).isEqualByComparingTo("0.5");
            assertThat(quote.getPriceAfter()).isEqualByComparingTo("0.51638904");
            assertThat(quote.getAvgPricePerShare()).isEqualByComparingTo("1.03333333");
        }

        @Test
        void doesNotMutate() {
            pool.quoteBuy(new BigDecimal("1000"));

            assertThat(pool.getCashReserve()).isEqualByComparingTo("30000");
            assertThat(pool.getTradeCount()).isZero();
        }

        @Test
        void rejectsNonPositiveAmounts() {
            assertThat(pool.quoteBuy(BigDecimal.ZERO).getError().getCode()).isEqualTo(ErrorCode.INVALID_AMOUNT);
            assertThat(pool.quoteBuy(new BigDecimal("-5")).getError().getCode()).isEqualTo(ErrorCode.INVALID_AMOUNT);
            assertThat(pool.quoteBuy(null).getError().getCode()).isEqualTo(ErrorCode.INVALID_AMOUNT);
        }

        @Test
        void rejectsMoreThanEightDecimals() {
            EngineResult<TradeQuote> result = pool.quoteBuy(new BigDecimal("1.000000001"));

            assertThat(result.getError().getCode()).isEqualTo(ErrorCode.INVALID_AMOUNT);
        }

        @Test
        @DisplayName("An amount too small to buy a single share unit is rejected")
        void rejectsDust() {
            EngineResult<TradeQuote> result = pool.quoteBuy(new BigDecimal("0.00000001"));

            assertThat(result.isFailure()).isTrue();
            assertThat(result.getError().getCode()).isEqualTo(ErrorCode.INVALID_AMOUNT);
        }
    }

    @Nested
    @DisplayName("applyBuy")
    class ApplyBuy {

        @Test
        void movesReservesAndCountsTheTrade() {
            pool.applyBuy(new BigDecimal("1000"));

            assertThat(pool.getCashReserve()).isEqualByComparingTo("31000");
            assertThat(pool.getShareReserve()).isEqualByComparingTo("29032.25806452");
            assertThat(pool.getTotalVolume()).isEqualByComparingTo("1000");
            assertThat(pool.getTradeCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Every buy strictly raises the price and yields fewer shares per unit")
        void monotonePrice() {
            BigDecimal previousPrice = pool.impliedPrice();
            BigDecimal previousShares = null;
            for (int i = 0; i < 20; i++) {
                TradeQuote quote = pool.applyBuy(new BigDecimal("750")).getValue();

                assertThat(quote.getSharesOut()).isPositive();
                assertThat(pool.impliedPrice()).isGreaterThan(previousPrice);
                if (previousShares != null) {
                    assertThat(quote.getSharesOut()).isLessThan(previousShares);
                }
                previousPrice = pool.impliedPrice();
                previousShares = quote.getSharesOut();
            }
            assertThat(pool.impliedPrice()).isLessThan(BigDecimal.ONE);
        }

        @Test
        @DisplayName("Reserves stay on the curve within one rounding unit after many odd-sized buys")
        void staysOnCurve() {
            String[] amounts = {"1", "0.12345678", "999999.99999999", "3.3", "42", "17.00000001", "250000"};
            for (int round = 0; round < 10; round++) {
                for (String amount : amounts) {
                    pool.applyBuy(new BigDecimal(amount));
                    assertThat(pool.isOnCurve(pool.getShareReserve(), pool.getCashReserve())).isTrue();
                }
            }
            BigDecimal deviation = pool.getShareReserve().multiply(pool.getCashReserve()).subtract(pool.getK());
            assertThat(deviation).isGreaterThanOrEqualTo(BigDecimal.ZERO);
            assertThat(deviation).isLessThanOrEqualTo(pool.getCashReserve().multiply(FixedPoint.UNIT));
        }

        @Test
        @DisplayName("A pool found off its curve throws and stays untouched")
        void corruptedPoolThrows() {
            OutcomePool corrupted = OutcomePool.builder()
                    .marketId("m-1")
                    .outcome("Yes")
                    .initialLiquidity(new BigDecimal("30000"))
                    .k(new BigDecimal("900000000"))
                    .shareReserve(new BigDecimal("20000"))
                    .cashReserve(new BigDecimal("30000"))
                    .build();

            assertThatThrownBy(() -> corrupted.applyBuy(new BigDecimal("10")))
                    .isInstanceOf(InvariantViolationException.class)
                    .hasMessageContaining("m-1");
            assertThat(corrupted.getShareReserve()).isEqualByComparingTo("20000");
            assertThat(corrupted.getTradeCount()).isZero();
        }

        @Test
        void failedQuoteLeavesPoolUntouched() {
            EngineResult<TradeQuote> result = pool.applyBuy(new BigDecimal("-1"));

            assertThat(result.isFailure()).isTrue();
            assertThat(pool.getCashReserve()).isEqualByComparingTo("30000");
        }
    }
}
