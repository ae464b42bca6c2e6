package com.prediction.market.amm.event;

import java.util.List;

import com.prediction.market.amm.entity.Position;

/**
 * Published after a bet has been applied to its pool and recorded.
 */
public class TradeExecutedEvent extends MarketEvent {

    private final Position position;

    public TradeExecutedEvent(Object source, Position position, long sequence) {
        super(source, position.getMarketId(), List.of(position.getUserId()), sequence);
        this.position = position;
    }

    public Position getPosition() {
        return position;
    }
}
