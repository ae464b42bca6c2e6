package com.prediction.market.amm.event;

import java.util.List;

import org.springframework.context.ApplicationEvent;

/**
 * Base for every notification the engine emits. Carries the market, the
 * users a notifier should reach, and a sequence number that increases
 * across all events of one engine instance.
 */
public abstract class MarketEvent extends ApplicationEvent {

    private final String marketId;
    private final List<String> userIds;
    private final long sequence;

    protected MarketEvent(Object source, String marketId, List<String> userIds, long sequence) {
        super(source);
        this.marketId = marketId;
        this.userIds = List.copyOf(userIds);
        this.sequence = sequence;
    }

    public String getMarketId() {
        return marketId;
    }

    public List<String> getUserIds() {
        return userIds;
    }

    public long getSequence() {
        return sequence;
    }
}
