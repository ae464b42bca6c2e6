package com.prediction.market.amm.engine;

/**
 * How implied prices are reported across the outcomes of one market.
 * Pools are independent curves, so their raw prices need not sum to 1.
 */
public enum PriceNormalization {

    /** Report each pool's own {@code cash / (cash + share)}. */
    INDEPENDENT,

    /** Divide each raw price by the sum of all raw prices so they sum to 1. */
    NORMALIZED
}
