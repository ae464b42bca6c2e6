package com.prediction.market.amm.entity;

import java.math.BigDecimal;
import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * A placed bet: one user's claim on one outcome of one market.
 *
 * Immutable after creation except for the single status change made at
 * settlement (OPEN → SETTLED for resolved markets, OPEN → VOIDED for
 * refunds). A user may hold any number of positions on the same outcome.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
@Document(collection = "positions")
@CompoundIndex(name = "market_user_idx", def = "{'marketId':1,'userId':1}")
@CompoundIndex(name = "market_status_idx", def = "{'marketId':1,'status':1}")
public class Position {

    @Id
    private String id;

    private String marketId;
    private String userId;
    private String outcome;

    private BigDecimal amountPaid;
    private BigDecimal sharesAcquired;
    private BigDecimal avgPricePerShare;

    private Instant placedAt;

    @Builder.Default
    private PositionStatus status = PositionStatus.OPEN;

    private Instant settledAt;

    @Builder.Default
    private BigDecimal payoutAmount = FixedPoint.ZERO;

    public boolean isOpen() {
        return status.isOpen();
    }

    /**
     * Close the position after resolution. Losers settle with zero.
     */
    public void settle(BigDecimal payout, Instant at) {
        close(PositionStatus.SETTLED, payout, at);
    }

    /**
     * Close the position by returning its stake.
     */
    public void voidWithRefund(Instant at) {
        close(PositionStatus.VOIDED, amountPaid, at);
    }

    private void close(PositionStatus newStatus, BigDecimal payout, Instant at) {
        if (!isOpen()) {
            throw new IllegalStateException(String.format(
                    "Position already closed: %s (positionId=%s)", status, id));
        }
        this.status = newStatus;
        this.payoutAmount = payout;
        this.settledAt = at;
    }
}
