package com.prediction.market.amm.service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.prediction.market.amm.config.AmmProperties;
import com.prediction.market.amm.entity.FixedPoint;
import com.prediction.market.amm.entity.Market;
import com.prediction.market.amm.entity.MarketStatus;
import com.prediction.market.amm.result.EngineResult;
import com.prediction.market.amm.result.ErrorCode;

import lombok.RequiredArgsConstructor;

/**
 * Bet validation.
 *
 * All bets pass here twice: once before the market lock is taken, to reject
 * obvious failures without contending, and again under the lock where the
 * answer is authoritative. Read-only.
 *
 * Order of checks: market state, bettor, outcome, amount.
 */
@Service
@RequiredArgsConstructor
public class BetValidator {

    private final AmmProperties properties;

    /**
     * @return the canonical outcome label on success
     */
    public EngineResult<String> validate(Market market, String outcome, BigDecimal amount, String bettorId,
            Instant now) {
        if (market.isHalted()) {
            return EngineResult.failure(ErrorCode.MARKET_HALTED,
                    "Market is halted pending remediation: " + market.getId());
        }
        if (market.getStatus() != MarketStatus.ACTIVE) {
            return EngineResult.failure(ErrorCode.MARKET_NOT_ACTIVE,
                    String.format("Market %s is %s", market.getId(), market.getStatus()));
        }
        if (market.hasEndTimePassed(now)) {
            return EngineResult.failure(ErrorCode.MARKET_ENDED,
                    String.format("Market %s ended at %s", market.getId(), market.getEndTime()));
        }

        if (bettorId == null || bettorId.isBlank()) {
            return EngineResult.failure(ErrorCode.INVALID_REQUEST, "Bettor id is required");
        }

        Optional<String> canonical = market.canonicalOutcome(outcome);
        if (canonical.isEmpty()) {
            return EngineResult.failure(ErrorCode.INVALID_OUTCOME,
                    String.format("Unknown outcome '%s', expected one of %s", outcome, market.getOutcomes()));
        }

        if (amount == null || amount.signum() <= 0) {
            return EngineResult.failure(ErrorCode.INVALID_AMOUNT, "Amount must be positive");
        }
        if (!FixedPoint.fitsScale(amount)) {
            return EngineResult.failure(ErrorCode.INVALID_AMOUNT,
                    String.format("Amount supports at most %d decimal places", FixedPoint.SCALE));
        }
        if (amount.compareTo(properties.getMinBet()) < 0 || amount.compareTo(properties.getMaxBet()) > 0) {
            return EngineResult.failure(ErrorCode.AMOUNT_OUT_OF_BOUNDS,
                    String.format("Amount %s outside [%s, %s]", amount.toPlainString(),
                            properties.getMinBet().toPlainString(), properties.getMaxBet().toPlainString()));
        }

        return EngineResult.success(canonical.get());
    }
}
