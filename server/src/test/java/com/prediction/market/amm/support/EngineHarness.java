package com.prediction.market.amm.support;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

import org.springframework.context.ApplicationEventPublisher;

import com.prediction.market.amm.cache.MarketStore;
import com.prediction.market.amm.cache.PositionStore;
import com.prediction.market.amm.cache.SettlementStore;
import com.prediction.market.amm.cache.VoteStore;
import com.prediction.market.amm.config.AmmProperties;
import com.prediction.market.amm.engine.PricingEngine;
import com.prediction.market.amm.entity.FixedPoint;
import com.prediction.market.amm.entity.Market;
import com.prediction.market.amm.entity.MarketStatus;
import com.prediction.market.amm.entity.Position;
import com.prediction.market.amm.event.EngineEventPublisher;
import com.prediction.market.amm.execution.MarketLockRegistry;
import com.prediction.market.amm.repositories.MarketRepository;
import com.prediction.market.amm.repositories.PayoutRepository;
import com.prediction.market.amm.repositories.PositionRepository;
import com.prediction.market.amm.repositories.ResolutionRepository;
import com.prediction.market.amm.repositories.ResolutionVoteRepository;
import com.prediction.market.amm.service.BetValidator;
import com.prediction.market.amm.service.MarketDefinition;
import com.prediction.market.amm.service.MarketLifecycleService;
import com.prediction.market.amm.service.MarketQueryService;
import com.prediction.market.amm.service.ResolutionCoordinator;
import com.prediction.market.amm.service.SettlementEngine;
import com.prediction.market.amm.service.TradeExecutor;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;

/**
 * Wires the real engine over mocked repositories and a controllable clock.
 */
public class EngineHarness {

    public static final Instant START = Instant.parse("2026-01-01T00:00:00Z");
    public static final Duration TRADING_WINDOW = Duration.ofDays(1);

    public final MarketRepository marketRepository = mock(MarketRepository.class);
    public final PositionRepository positionRepository = mock(PositionRepository.class);
    public final ResolutionVoteRepository voteRepository = mock(ResolutionVoteRepository.class);
    public final ResolutionRepository resolutionRepository = mock(ResolutionRepository.class);
    public final PayoutRepository payoutRepository = mock(PayoutRepository.class);
    public final ApplicationEventPublisher applicationEventPublisher = mock(ApplicationEventPublisher.class);

    public final MutableClock clock = new MutableClock(START);
    public final AmmProperties properties = new AmmProperties();

    public final MarketStore marketStore;
    public final PositionStore positionStore;
    public final VoteStore voteStore;
    public final SettlementStore settlementStore;
    public final MarketLockRegistry lockRegistry;
    public final PricingEngine pricingEngine;
    public final TradeExecutor tradeExecutor;
    public final SettlementEngine settlementEngine;
    public final MarketLifecycleService lifecycleService;
    public final ResolutionCoordinator resolutionCoordinator;
    public final MarketQueryService queryService;

    public EngineHarness() {
        this(properties -> {
        });
    }

    public EngineHarness(Consumer<AmmProperties> customizer) {
        customizer.accept(properties);

        Retry retry = Retry.of("test", RetryConfig.custom().maxAttempts(1).build());
        marketStore = new MarketStore(marketRepository, retry);
        positionStore = new PositionStore(positionRepository, retry);
        voteStore = new VoteStore(voteRepository, retry);
        settlementStore = new SettlementStore(resolutionRepository, payoutRepository, retry);
        lockRegistry = new MarketLockRegistry(properties.getLockTimeout());
        pricingEngine = new PricingEngine(properties.getPriceNormalization());

        EngineEventPublisher eventPublisher = new EngineEventPublisher(applicationEventPublisher);
        tradeExecutor = new TradeExecutor(marketStore, positionStore, lockRegistry, new BetValidator(properties),
                eventPublisher, clock);
        settlementEngine = new SettlementEngine(marketStore, positionStore, settlementStore, lockRegistry,
                eventPublisher, properties, clock);
        lifecycleService = new MarketLifecycleService(marketStore, positionStore, voteStore, settlementStore, settlementEngine,
                lockRegistry, properties, clock);
        resolutionCoordinator = new ResolutionCoordinator(marketStore, voteStore, lifecycleService,
                settlementEngine, lockRegistry, properties, clock);
        queryService = new MarketQueryService(marketStore, positionStore, settlementStore, pricingEngine,
                lockRegistry);
    }

    /**
     * ACTIVE market seeded with 30000 per outcome, trading for one day from now.
     */
    public Market openMarket(String... outcomes) {
        return lifecycleService.createMarket(MarketDefinition.builder()
                .question("Will it happen?")
                .creatorId("creator")
                .outcomes(List.of(outcomes))
                .initialLiquidity(new BigDecimal("30000"))
                .endTime(clock.instant().plus(TRADING_WINDOW))
                .build())
                .getValue();
    }

    public void bet(Market market, String outcome, String amount, String userId) {
        tradeExecutor.placeBet(market.getId(), outcome, new BigDecimal(amount), userId).getValue();
    }

    public void passEndTime() {
        clock.advance(TRADING_WINDOW.plusSeconds(1));
    }

    /**
     * ENDED market as a restarted process finds it: nothing cached, the
     * market and its positions served by the mocked repositories.
     */
    public Market storedEndedMarket(String marketId, Position... positions) {
        Market market = Market.open(marketId, "Will it happen?", null, "creator", List.of("Yes", "No"),
                new BigDecimal("30000"), START.minus(Duration.ofDays(2)), START.minus(Duration.ofDays(1)),
                START.plus(Duration.ofDays(4)));
        market.compareAndTransition(MarketStatus.ACTIVE, MarketStatus.ENDED, START.minus(Duration.ofDays(1)));
        when(marketRepository.findById(marketId)).thenReturn(Optional.of(market));
        when(marketRepository.findByStatusIn(any())).thenReturn(List.of(market));
        when(positionRepository.findByMarketIdOrderByPlacedAtAsc(marketId)).thenReturn(List.of(positions));
        return market;
    }

    public static Position storedPosition(String positionId, String marketId, String userId, String outcome,
            String amountPaid, String sharesAcquired) {
        BigDecimal paid = new BigDecimal(amountPaid);
        BigDecimal shares = new BigDecimal(sharesAcquired);
        return Position.builder()
                .id(positionId)
                .marketId(marketId)
                .userId(userId)
                .outcome(outcome)
                .amountPaid(paid)
                .sharesAcquired(shares)
                .avgPricePerShare(FixedPoint.divide(paid, shares))
                .placedAt(START.minus(Duration.ofDays(1)).minusSeconds(60))
                .build();
    }
}
