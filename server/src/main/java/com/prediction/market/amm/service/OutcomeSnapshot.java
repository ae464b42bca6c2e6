package com.prediction.market.amm.service;

import java.math.BigDecimal;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class OutcomeSnapshot {
    String outcome;
    BigDecimal shareReserve;
    BigDecimal cashReserve;
    BigDecimal k;
    BigDecimal impliedPrice;
    BigDecimal totalVolume;
    long tradeCount;
}
