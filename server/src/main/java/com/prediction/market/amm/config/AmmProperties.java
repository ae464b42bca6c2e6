package com.prediction.market.amm.config;

import java.math.BigDecimal;
import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import com.prediction.market.amm.engine.PayoutModel;
import com.prediction.market.amm.engine.PriceNormalization;

import lombok.Data;

/**
 * Engine configuration, bound from the {@code amm.*} properties.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "amm")
public class AmmProperties {

    /** Fee on gross winnings, in basis points */
    private int houseEdgeBps = 0;

    /** Per-bet bounds, inclusive */
    private BigDecimal minBet = new BigDecimal("1");
    private BigDecimal maxBet = new BigDecimal("1000000");

    /** Seed liquidity when a create request does not supply one */
    private BigDecimal defaultInitialLiquidity = new BigDecimal("30000");

    private int minResolutionVotes = 2;

    /** How long a request waits for a market lock before failing with MARKET_BUSY */
    private Duration lockTimeout = Duration.ofMillis(250);

    /** Default resolution deadline, counted from endTime */
    private Duration autoRefundWindow = Duration.ofHours(120);

    private Duration disputeWindow = Duration.ofHours(24);

    private PriceNormalization priceNormalization = PriceNormalization.INDEPENDENT;
    private PayoutModel payoutModel = PayoutModel.PAR_VALUE;

    private StorageRetry storageRetry = new StorageRetry();

    @Data
    public static class StorageRetry {
        private int maxAttempts = 3;
        private Duration waitDuration = Duration.ofMillis(200);
    }
}
