package com.prediction.market.amm.entity;

public enum PositionStatus {
    OPEN,
    SETTLED,
    VOIDED;

    public boolean isOpen() {
        return this == OPEN;
    }
}
