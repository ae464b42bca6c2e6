package com.prediction.market.amm.entity;

public enum ResolutionMethod {
    ADMIN_DECISION,
    VOTE_CONSENSUS,
    ORACLE,
    AUTO_REFUND
}
