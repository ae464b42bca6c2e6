package com.prediction.market.amm.engine;

/**
 * How a winning position's gross payout is computed at settlement.
 */
public enum PayoutModel {

    /** Each winning share redeems at par value of one unit. */
    PAR_VALUE,

    /**
     * The whole pool is split among winners pro rata by shares. Rounding dust
     * goes to the last winner so the gross total equals the pool exactly.
     */
    POOL_SHARE
}
