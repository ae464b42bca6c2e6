package com.prediction.market.amm.entity;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-precision arithmetic for reserves, cash amounts, shares and prices.
 *
 * CRITICAL: Never use double/float for pool math!
 * Every quantity in the engine is a BigDecimal with 8 fractional digits.
 * Rounding direction is chosen per operation: the curve rounds in favour of
 * the pool, everything else uses banker's rounding.
 */
public final class FixedPoint {

    /**
     * Fixed scale for all quantities (8 decimal places).
     */
    public static final int SCALE = 8;

    /**
     * Default rounding mode: HALF_EVEN (banker's rounding).
     */
    public static final RoundingMode ROUNDING_MODE = RoundingMode.HALF_EVEN;

    /**
     * Smallest representable quantity (10^-8).
     */
    public static final BigDecimal UNIT = BigDecimal.ONE.movePointLeft(SCALE);

    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);
    public static final BigDecimal ONE = BigDecimal.ONE.setScale(SCALE);

    private static final BigDecimal BPS_DENOMINATOR = BigDecimal.valueOf(10_000);

    private FixedPoint() {
    }

    /**
     * Create a fixed-point value from a string (safest for parsing user input).
     */
    public static BigDecimal of(String amount) {
        if (amount == null || amount.trim().isEmpty()) {
            throw new IllegalArgumentException("Amount string cannot be null or empty");
        }
        try {
            return normalize(new BigDecimal(amount.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid amount format: " + amount, e);
        }
    }

    /**
     * Create a fixed-point value from a whole amount.
     */
    public static BigDecimal of(long amount) {
        return BigDecimal.valueOf(amount).setScale(SCALE);
    }

    /**
     * Bring a value to the engine scale with banker's rounding.
     */
    public static BigDecimal normalize(BigDecimal value) {
        if (value == null) {
            throw new IllegalArgumentException("Amount cannot be null");
        }
        return value.setScale(SCALE, ROUNDING_MODE);
    }

    /**
     * True when the value carries no more fractional digits than the engine keeps.
     */
    public static boolean fitsScale(BigDecimal value) {
        return value.stripTrailingZeros().scale() <= SCALE;
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    public static BigDecimal add(BigDecimal a, BigDecimal b) {
        return normalize(a.add(b));
    }

    public static BigDecimal subtract(BigDecimal a, BigDecimal b) {
        return normalize(a.subtract(b));
    }

    /**
     * Exact product, not rescaled. Used for invariant checks on {@code share * cash}.
     */
    public static BigDecimal product(BigDecimal a, BigDecimal b) {
        return a.multiply(b);
    }

    /**
     * Divide with banker's rounding at the engine scale.
     */
    public static BigDecimal divide(BigDecimal dividend, BigDecimal divisor) {
        requireNonZero(divisor);
        return dividend.divide(divisor, SCALE, ROUNDING_MODE);
    }

    /**
     * Divide rounding toward positive infinity at the engine scale.
     * The bonding curve uses this so the pool never gives away a rounding unit.
     */
    public static BigDecimal divideUp(BigDecimal dividend, BigDecimal divisor) {
        requireNonZero(divisor);
        return dividend.divide(divisor, SCALE, RoundingMode.CEILING);
    }

    /**
     * Divide rounding toward zero at the engine scale.
     */
    public static BigDecimal divideDown(BigDecimal dividend, BigDecimal divisor) {
        requireNonZero(divisor);
        return dividend.divide(divisor, SCALE, RoundingMode.DOWN);
    }

    /**
     * {@code amount * bps / 10000} with banker's rounding.
     */
    public static BigDecimal basisPoints(BigDecimal amount, int bps) {
        return amount.multiply(BigDecimal.valueOf(bps)).divide(BPS_DENOMINATOR, SCALE, ROUNDING_MODE);
    }

    /**
     * Sum of values at the engine scale; ZERO for an empty input.
     */
    public static BigDecimal sum(Iterable<BigDecimal> values) {
        BigDecimal total = ZERO;
        for (BigDecimal value : values) {
            total = total.add(value);
        }
        return normalize(total);
    }

    private static void requireNonZero(BigDecimal divisor) {
        if (divisor.signum() == 0) {
            throw new ArithmeticException("Cannot divide by zero");
        }
    }
}
