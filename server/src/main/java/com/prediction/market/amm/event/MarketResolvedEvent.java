package com.prediction.market.amm.event;

import java.util.List;

import com.prediction.market.amm.entity.Resolution;

/**
 * Published once a market reaches a terminal status and its resolution is recorded.
 * userIds holds every user with a position on the market.
 */
public class MarketResolvedEvent extends MarketEvent {

    private final Resolution resolution;

    public MarketResolvedEvent(Object source, Resolution resolution, List<String> userIds, long sequence) {
        super(source, resolution.getMarketId(), userIds, sequence);
        this.resolution = resolution;
    }

    public Resolution getResolution() {
        return resolution;
    }
}
