package com.prediction.market.amm.entity;

import java.math.BigDecimal;
import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Settlement record for one position. At most one per position
 * (unique index on positionId).
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
@Document(collection = "payouts")
public class Payout {

    @Id
    private String id;

    @Indexed
    private String marketId;

    @Indexed(unique = true)
    private String positionId;

    @Indexed
    private String userId;

    private String outcome;
    private PayoutKind kind;

    private BigDecimal amountPaid;
    private BigDecimal sharesAcquired;

    private BigDecimal grossAmount;
    private BigDecimal fee;

    /**
     * grossAmount - fee
     */
    private BigDecimal netAmount;

    /**
     * netAmount - amountPaid
     */
    private BigDecimal profitLoss;

    private Instant createdAt;
}
