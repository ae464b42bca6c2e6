package com.prediction.market.amm.entity;

public enum PayoutKind {
    WINNING,
    REFUND
}
