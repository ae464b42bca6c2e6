package com.prediction.market.amm.entity;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * A single prediction question with one bonding-curve pool per outcome.
 *
 * IMPORTANT: all mutation happens under the market's execution lock
 * (see {@code MarketLockRegistry}). Status changes go through
 * {@link #compareAndTransition(MarketStatus, MarketStatus, Instant)}.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
@Document(collection = "markets")
public class Market {

    public static final int MIN_OUTCOMES = 2;
    public static final int MAX_OUTCOMES = 10;

    @Id
    private String id;

    private String question;
    private String description;
    private String creatorId;

    /**
     * Outcome labels in display order.
     */
    private List<String> outcomes;

    /**
     * One pool per outcome, same order as {@link #outcomes}.
     */
    private List<OutcomePool> pools;

    @Indexed
    @Builder.Default
    private MarketStatus status = MarketStatus.ACTIVE;

    private Instant createdAt;
    private Instant updatedAt;

    @Indexed
    private Instant endTime;

    private Instant resolutionDeadline;

    private BigDecimal initialLiquidity;

    @Builder.Default
    private BigDecimal totalVolume = FixedPoint.ZERO;

    @Builder.Default
    private long totalTrades = 0;

    private String winningOutcome;
    private Instant settlementCompletedAt;

    /**
     * Set when an invariant violation halted the market. Needs manual remediation.
     */
    private String haltReason;

    /**
     * Seed a new ACTIVE market and its pools. Inputs are validated by the caller.
     */
    public static Market open(String id, String question, String description, String creatorId,
            List<String> outcomes, BigDecimal initialLiquidity,
            Instant createdAt, Instant endTime, Instant resolutionDeadline) {
        List<OutcomePool> pools = new ArrayList<>(outcomes.size());
        for (String outcome : outcomes) {
            pools.add(OutcomePool.seed(id, outcome, initialLiquidity));
        }
        return Market.builder()
                .id(id)
                .question(question)
                .description(description)
                .creatorId(creatorId)
                .outcomes(List.copyOf(outcomes))
                .pools(pools)
                .status(MarketStatus.ACTIVE)
                .createdAt(createdAt)
                .updatedAt(createdAt)
                .endTime(endTime)
                .resolutionDeadline(resolutionDeadline)
                .initialLiquidity(FixedPoint.normalize(initialLiquidity))
                .build();
    }

    // ===== Outcomes =====

    /**
     * Resolve a user-supplied label to the canonical outcome label (case-insensitive).
     */
    public Optional<String> canonicalOutcome(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String trimmed = label.trim();
        return outcomes.stream()
                .filter(o -> o.equalsIgnoreCase(trimmed))
                .findFirst();
    }

    public OutcomePool pool(String outcome) {
        return pools.stream()
                .filter(p -> p.getOutcome().equals(outcome))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        String.format("No pool for outcome %s on market %s", outcome, id)));
    }

    // ===== State Machine Methods =====

    /**
     * Atomic compare-and-set on status. Caller holds the market lock, which
     * makes check, effect and set one indivisible step.
     *
     * @return false if the current status is not {@code expected}
     * @throws IllegalStateException if {@code expected → next} is not a legal transition
     */
    public boolean compareAndTransition(MarketStatus expected, MarketStatus next, Instant at) {
        if (!expected.canTransitionTo(next)) {
            throw new IllegalStateException(String.format(
                    "Invalid market state transition: %s → %s (marketId=%s)", expected, next, id));
        }
        if (this.status != expected) {
            return false;
        }
        this.status = next;
        this.updatedAt = at;
        return true;
    }

    public void recordWinner(String outcome) {
        this.winningOutcome = outcome;
    }

    public void recordTrade(BigDecimal cashIn, Instant at) {
        this.totalVolume = FixedPoint.add(totalVolume, cashIn);
        this.totalTrades++;
        this.updatedAt = at;
    }

    public void halt(String reason, Instant at) {
        if (this.haltReason == null) {
            this.haltReason = reason;
            this.updatedAt = at;
        }
    }

    public void markSettled(Instant at) {
        if (this.settlementCompletedAt == null) {
            this.settlementCompletedAt = at;
            this.updatedAt = at;
        }
    }

    public boolean isHalted() {
        return haltReason != null;
    }

    public boolean isSettled() {
        return settlementCompletedAt != null;
    }

    public boolean hasEndTimePassed(Instant now) {
        return !now.isBefore(endTime);
    }

    public boolean hasResolutionDeadlinePassed(Instant now) {
        return resolutionDeadline != null && !now.isBefore(resolutionDeadline);
    }
}
