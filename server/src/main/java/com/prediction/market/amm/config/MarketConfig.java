package com.prediction.market.amm.config;

import java.time.Clock;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.prediction.market.amm.cache.MarketStore;
import com.prediction.market.amm.cache.PositionStore;
import com.prediction.market.amm.cache.SettlementStore;
import com.prediction.market.amm.cache.VoteStore;
import com.prediction.market.amm.engine.PricingEngine;
import com.prediction.market.amm.event.EngineEventPublisher;
import com.prediction.market.amm.execution.MarketLockRegistry;
import com.prediction.market.amm.repositories.MarketRepository;
import com.prediction.market.amm.repositories.PayoutRepository;
import com.prediction.market.amm.repositories.PositionRepository;
import com.prediction.market.amm.repositories.ResolutionRepository;
import com.prediction.market.amm.repositories.ResolutionVoteRepository;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;

@Configuration
public class MarketConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Retry storageRetry(AmmProperties properties) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(properties.getStorageRetry().getMaxAttempts())
                .waitDuration(properties.getStorageRetry().getWaitDuration())
                .build();
        return Retry.of("storage", config);
    }

    @Bean
    public MarketStore marketStore(MarketRepository marketRepository, Retry storageRetry) {
        return new MarketStore(marketRepository, storageRetry);
    }

    @Bean
    public PositionStore positionStore(PositionRepository positionRepository, Retry storageRetry) {
        return new PositionStore(positionRepository, storageRetry);
    }

    @Bean
    public VoteStore voteStore(ResolutionVoteRepository voteRepository, Retry storageRetry) {
        return new VoteStore(voteRepository, storageRetry);
    }

    @Bean
    public SettlementStore settlementStore(ResolutionRepository resolutionRepository,
            PayoutRepository payoutRepository, Retry storageRetry) {
        return new SettlementStore(resolutionRepository, payoutRepository, storageRetry);
    }

    @Bean
    public MarketLockRegistry marketLockRegistry(AmmProperties properties) {
        return new MarketLockRegistry(properties.getLockTimeout());
    }

    @Bean
    PricingEngine pricingEngine(AmmProperties properties) {
        return new PricingEngine(properties.getPriceNormalization());
    }

    @Bean
    public EngineEventPublisher engineEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        return new EngineEventPublisher(applicationEventPublisher);
    }
}
