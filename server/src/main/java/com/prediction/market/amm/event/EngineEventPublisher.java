package com.prediction.market.amm.event;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import org.springframework.context.ApplicationEventPublisher;

import com.prediction.market.amm.entity.Payout;
import com.prediction.market.amm.entity.Position;
import com.prediction.market.amm.entity.Resolution;

import lombok.extern.slf4j.Slf4j;

/**
 * Typed factory methods over Spring's {@link ApplicationEventPublisher}.
 *
 * Publication is best-effort: a failing listener is logged and never
 * propagates into the engine operation that already committed its state.
 * Callers publish after releasing the market lock.
 */
@Slf4j
public class EngineEventPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;
    private final AtomicLong sequence = new AtomicLong();

    public EngineEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    public void publishTradeExecuted(Position position) {
        publish(new TradeExecutedEvent(this, position, sequence.incrementAndGet()));
    }

    public void publishMarketResolved(Resolution resolution, List<String> userIds) {
        publish(new MarketResolvedEvent(this, resolution, userIds, sequence.incrementAndGet()));
    }

    public void publishPayoutReady(String marketId, List<Payout> payouts) {
        if (payouts.isEmpty()) {
            return;
        }
        publish(new PayoutReadyEvent(this, marketId, payouts, sequence.incrementAndGet()));
    }

    private void publish(MarketEvent event) {
        try {
            applicationEventPublisher.publishEvent(event);
        } catch (RuntimeException e) {
            log.warn("Event delivery failed: type={}, marketId={}, sequence={}",
                    event.getClass().getSimpleName(), event.getMarketId(), event.getSequence(), e);
        }
    }
}
