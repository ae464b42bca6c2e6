package com.prediction.market.amm.service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import com.prediction.market.amm.engine.PriceNormalization;
import com.prediction.market.amm.entity.MarketStatus;

import lombok.Builder;
import lombok.Value;

/**
 * Consistent read of a market taken under its lock.
 */
@Value
@Builder
public class MarketSnapshot {
    String marketId;
    String question;
    String description;
    MarketStatus status;
    List<OutcomeSnapshot> outcomes;
    PriceNormalization priceNormalization;
    BigDecimal totalVolume;
    long totalTrades;
    Instant endTime;
    Instant resolutionDeadline;
    String winningOutcome;
    String haltReason;
    Instant settlementCompletedAt;
}
