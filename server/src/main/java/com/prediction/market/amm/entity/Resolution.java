package com.prediction.market.amm.entity;

import java.math.BigDecimal;
import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * The recorded decision that took a market to a terminal state.
 * Keyed by market id, so storage itself refuses a second record.
 * Immutable once written.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
@Document(collection = "resolutions")
public class Resolution {

    @Id
    private String marketId;

    /**
     * Null for refunded and cancelled markets.
     */
    private String winningOutcome;

    private MarketStatus finalStatus;
    private ResolutionMethod method;
    private String resolvedBy;
    private Instant resolvedAt;

    private int voteCount;

    private BigDecimal totalPool;
    private BigDecimal totalWinningStake;
    private BigDecimal totalLosingStake;

    private int houseEdgeBps;
    private BigDecimal houseEdgeAmount;
    private BigDecimal totalPayouts;

    private Instant disputeDeadline;
}
