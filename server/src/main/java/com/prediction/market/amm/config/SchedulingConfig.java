package com.prediction.market.amm.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Turns on the write-behind flushes and the lifecycle sweep.
 * Disabled with {@code amm.scheduling.enabled=false}.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "amm.scheduling", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
