package com.prediction.market.amm.event;

import java.util.List;
import java.util.stream.Collectors;

import com.prediction.market.amm.entity.Payout;

/**
 * Published after settlement created payouts; one event per settlement run.
 */
public class PayoutReadyEvent extends MarketEvent {

    private final List<Payout> payouts;

    public PayoutReadyEvent(Object source, String marketId, List<Payout> payouts, long sequence) {
        super(source, marketId, payouts.stream().map(Payout::getUserId).distinct().collect(Collectors.toList()),
                sequence);
        this.payouts = List.copyOf(payouts);
    }

    public List<Payout> getPayouts() {
        return payouts;
    }
}
