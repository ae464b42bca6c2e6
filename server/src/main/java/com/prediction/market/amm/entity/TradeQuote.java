package com.prediction.market.amm.entity;

import java.math.BigDecimal;

import lombok.Builder;
import lombok.Value;

/**
 * Result of pricing a buy against one outcome pool. Pure data; producing a
 * quote never touches the pool.
 */
@Value
@Builder
public class TradeQuote {
    String outcome;
    BigDecimal cashIn;
    BigDecimal sharesOut;
    BigDecimal avgPricePerShare;
    BigDecimal priceBefore;
    BigDecimal priceAfter;
    BigDecimal newCashReserve;
    BigDecimal newShareReserve;
}
