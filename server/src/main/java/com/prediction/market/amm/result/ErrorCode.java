package com.prediction.market.amm.result;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    INVALID_AMOUNT(ErrorKind.VALIDATION),
    AMOUNT_OUT_OF_BOUNDS(ErrorKind.VALIDATION),
    INVALID_OUTCOME(ErrorKind.VALIDATION),
    INVALID_MARKET(ErrorKind.VALIDATION),
    INVALID_VOTE(ErrorKind.VALIDATION),
    INVALID_REQUEST(ErrorKind.VALIDATION),

    MARKET_NOT_FOUND(ErrorKind.NOT_FOUND),
    RESOLUTION_NOT_FOUND(ErrorKind.NOT_FOUND),

    MARKET_NOT_ACTIVE(ErrorKind.STATE_CONFLICT),
    MARKET_ENDED(ErrorKind.STATE_CONFLICT),
    MARKET_HALTED(ErrorKind.STATE_CONFLICT),
    INVALID_TRANSITION(ErrorKind.STATE_CONFLICT),
    VOTING_CLOSED(ErrorKind.STATE_CONFLICT),
    VOTE_FINALIZED(ErrorKind.STATE_CONFLICT),
    INSUFFICIENT_VOTES(ErrorKind.STATE_CONFLICT),
    NOT_SETTLEABLE(ErrorKind.STATE_CONFLICT),

    MARKET_BUSY(ErrorKind.RESOURCE_BUSY),

    RESOLUTION_TIED(ErrorKind.RESOLUTION_TIED);

    private final ErrorKind kind;
}
