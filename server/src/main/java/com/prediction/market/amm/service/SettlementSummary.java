package com.prediction.market.amm.service;

import java.math.BigDecimal;
import java.time.Instant;

import com.prediction.market.amm.entity.MarketStatus;

import lombok.Builder;
import lombok.Value;

/**
 * Totals over every payout of a terminal market. Identical on every call
 * once the market is settled.
 */
@Value
@Builder
public class SettlementSummary {
    String marketId;
    MarketStatus status;
    String winningOutcome;
    BigDecimal totalPool;
    BigDecimal totalGross;
    BigDecimal houseEdgeAmount;
    BigDecimal totalPayouts;
    int payoutCount;
    int positionsSettled;
    Instant settledAt;
}
