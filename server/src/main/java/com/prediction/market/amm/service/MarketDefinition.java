package com.prediction.market.amm.service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import lombok.Builder;
import lombok.Value;

/**
 * Input for creating a market. Optional fields may be null and fall back
 * to configured defaults.
 */
@Value
@Builder
public class MarketDefinition {
    String question;
    String description;
    String creatorId;
    List<String> outcomes;
    Instant endTime;
    Instant resolutionDeadline;
    BigDecimal initialLiquidity;
}
