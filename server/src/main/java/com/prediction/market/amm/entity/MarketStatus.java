package com.prediction.market.amm.entity;

/**
 * Market lifecycle state machine.
 *
 * State Transitions:
 *
 * ACTIVE → PAUSED     (admin pause)
 * PAUSED → ACTIVE     (admin resume)
 * ACTIVE → ENDED      (endTime reached or admin close)
 * PAUSED → ENDED      (endTime reached while paused)
 * ENDED  → RESOLVED   (winning outcome decided, payouts settled)
 * ENDED  → REFUNDED   (no resolution before the deadline, or market invalid)
 * ACTIVE/PAUSED/ENDED → CANCELLED (administrative abort)
 *
 * Terminal states: RESOLVED, REFUNDED, CANCELLED
 */
public enum MarketStatus {

    /**
     * ACTIVE: accepting bets.
     */
    ACTIVE,

    /**
     * PAUSED: temporarily not accepting bets.
     */
    PAUSED,

    /**
     * ENDED: trading closed, waiting for resolution.
     */
    ENDED,

    /**
     * RESOLVED: a winning outcome was recorded. TERMINAL.
     */
    RESOLVED,

    /**
     * REFUNDED: every position returned its stake. TERMINAL.
     */
    REFUNDED,

    /**
     * CANCELLED: aborted by an administrator; settles like REFUNDED. TERMINAL.
     */
    CANCELLED;

    public boolean isTerminal() {
        return this == RESOLVED || this == REFUNDED || this == CANCELLED;
    }

    /**
     * Settlement returns stakes instead of paying winners.
     */
    public boolean isRefundLike() {
        return this == REFUNDED || this == CANCELLED;
    }

    public boolean canTransitionTo(MarketStatus to) {
        if (this.isTerminal()) {
            return false;
        }

        return switch (this) {
            case ACTIVE -> to == PAUSED || to == ENDED || to == CANCELLED;
            case PAUSED -> to == ACTIVE || to == ENDED || to == CANCELLED;
            case ENDED -> to == RESOLVED || to == REFUNDED || to == CANCELLED;
            default -> false;
        };
    }
}
