package com.prediction.market.amm.result;

import lombok.Getter;

/**
 * Thrown when engine state breaks an invariant it must never break:
 * pool reserves drifting off the curve, or settlement paying out more than
 * the pool holds.
 *
 * This is a programming or data-corruption error, never a user error. It is
 * never caught and corrected silently; the affected market is halted for
 * manual remediation.
 */
@Getter
public class InvariantViolationException extends RuntimeException {

    private final String marketId;

    public InvariantViolationException(String marketId, String message) {
        super(String.format("Invariant violated on market %s: %s", marketId, message));
        this.marketId = marketId;
    }
}
