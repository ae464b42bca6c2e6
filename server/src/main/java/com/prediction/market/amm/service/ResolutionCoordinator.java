package com.prediction.market.amm.service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.prediction.market.amm.cache.MarketStore;
import com.prediction.market.amm.cache.VoteStore;
import com.prediction.market.amm.config.AmmProperties;
import com.prediction.market.amm.entity.Market;
import com.prediction.market.amm.entity.MarketStatus;
import com.prediction.market.amm.entity.ResolutionMethod;
import com.prediction.market.amm.entity.ResolutionVote;
import com.prediction.market.amm.execution.MarketLockRegistry;
import com.prediction.market.amm.result.EngineResult;
import com.prediction.market.amm.result.ErrorCode;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Collects resolution votes and decides the winning outcome, either by
 * weighted consensus or by an administrator. A decision moves the market
 * to RESOLVED and settles it in the same lock scope.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResolutionCoordinator {

    static final String CONSENSUS_ACTOR = "consensus";

    private final MarketStore marketStore;
    private final VoteStore voteStore;
    private final MarketLifecycleService lifecycleService;
    private final SettlementEngine settlementEngine;
    private final MarketLockRegistry lockRegistry;
    private final AmmProperties properties;
    private final Clock clock;

    /**
     * Record or revise a voter's opinion. Weight defaults to 1.
     */
    public EngineResult<ResolutionVote> castVote(String marketId, String voterId, String outcome,
            Integer confidence, Integer weight, boolean isFinal, String reasoning) {
        if (voterId == null || voterId.isBlank()) {
            return EngineResult.failure(ErrorCode.INVALID_REQUEST, "Voter id is required");
        }
        Optional<Market> found = marketStore.find(marketId);
        if (found.isEmpty()) {
            return EngineResult.failure(ErrorCode.MARKET_NOT_FOUND, "Market not found: " + marketId);
        }
        Market market = found.get();

        EngineResult<ResolutionVote> result = lockRegistry.executeWithLock(marketId, () -> {
            if (market.getStatus().isTerminal()) {
                return EngineResult.failure(ErrorCode.VOTING_CLOSED,
                        String.format("Market %s is %s, voting is closed", marketId, market.getStatus()));
            }
            Optional<String> chosen = market.canonicalOutcome(outcome);
            if (chosen.isEmpty()) {
                return EngineResult.failure(ErrorCode.INVALID_OUTCOME,
                        String.format("Unknown outcome '%s', expected one of %s", outcome, market.getOutcomes()));
            }
            int effectiveWeight = weight != null ? weight : ResolutionVote.DEFAULT_WEIGHT;
            if (effectiveWeight < 1) {
                return EngineResult.failure(ErrorCode.INVALID_VOTE, "Vote weight must be at least 1");
            }
            if (confidence != null
                    && (confidence < ResolutionVote.MIN_CONFIDENCE || confidence > ResolutionVote.MAX_CONFIDENCE)) {
                return EngineResult.failure(ErrorCode.INVALID_VOTE, String.format(
                        "Confidence must be between %d and %d", ResolutionVote.MIN_CONFIDENCE,
                        ResolutionVote.MAX_CONFIDENCE));
            }

            Instant now = clock.instant();
            Optional<ResolutionVote> existing = voteStore.find(marketId, voterId);
            ResolutionVote vote;
            if (existing.isPresent()) {
                vote = existing.get();
                if (vote.isFinal()) {
                    return EngineResult.failure(ErrorCode.VOTE_FINALIZED,
                            String.format("Vote of %s on market %s is final", voterId, marketId));
                }
                vote.revise(chosen.get(), confidence, reasoning, effectiveWeight, isFinal, now);
            } else {
                vote = ResolutionVote.builder()
                        .id(ResolutionVote.idFor(marketId, voterId))
                        .marketId(marketId)
                        .voterId(voterId)
                        .chosenOutcome(chosen.get())
                        .confidence(confidence)
                        .reasoning(reasoning)
                        .weight(effectiveWeight)
                        .isFinal(isFinal)
                        .createdAt(now)
                        .updatedAt(now)
                        .build();
            }
            voteStore.upsert(vote);
            log.info("Vote recorded: marketId={}, voterId={}, outcome={}, weight={}, final={}",
                    marketId, voterId, chosen.get(), effectiveWeight, isFinal);
            return EngineResult.success(vote);
        });

        if (result.isFailure()) {
            log.warn("Vote rejected: marketId={}, voterId={}, code={}, reason={}",
                    marketId, voterId, result.getError().getCode(), result.getError().getMessage());
        }
        return result;
    }

    /**
     * Resolve by weighted vote: the outcome with the highest total weight wins.
     * A tie on the top weight yields RESOLUTION_TIED and leaves the market ENDED.
     */
    public EngineResult<SettlementSummary> attemptResolve(String marketId) {
        return decide(marketId, market -> {
            List<ResolutionVote> votes = voteStore.forMarket(marketId);
            if (votes.size() < properties.getMinResolutionVotes()) {
                return EngineResult.failure(ErrorCode.INSUFFICIENT_VOTES, String.format(
                        "Market %s has %d votes, needs %d", marketId, votes.size(),
                        properties.getMinResolutionVotes()));
            }

            Map<String, Long> tally = tally(market, votes);
            long top = tally.values().stream().mapToLong(Long::longValue).max().orElse(0);
            List<String> leaders = tally.entrySet().stream()
                    .filter(e -> e.getValue() == top)
                    .map(Map.Entry::getKey)
                    .collect(Collectors.toList());
            if (leaders.size() > 1) {
                return EngineResult.failure(ErrorCode.RESOLUTION_TIED,
                        String.format("Market %s tied between %s with weight %d", marketId, leaders, top));
            }

            log.info("Consensus reached: marketId={}, winner={}, tally={}", marketId, leaders.get(0), tally);
            return settlementEngine.finalizeLocked(market, MarketStatus.ENDED, MarketStatus.RESOLVED,
                    leaders.get(0), ResolutionMethod.VOTE_CONSENSUS, CONSENSUS_ACTOR, votes.size());
        });
    }

    /**
     * Administrator names the winner; votes are not counted.
     */
    public EngineResult<SettlementSummary> resolveByAdmin(String marketId, String outcome, String resolvedBy) {
        return decide(marketId, market -> {
            Optional<String> winner = market.canonicalOutcome(outcome);
            if (winner.isEmpty()) {
                return EngineResult.failure(ErrorCode.INVALID_OUTCOME,
                        String.format("Unknown outcome '%s', expected one of %s", outcome, market.getOutcomes()));
            }
            return settlementEngine.finalizeLocked(market, MarketStatus.ENDED, MarketStatus.RESOLVED,
                    winner.get(), ResolutionMethod.ADMIN_DECISION, resolvedBy,
                    voteStore.forMarket(marketId).size());
        });
    }

    /**
     * With an outcome this is an admin decision, without one a consensus attempt.
     */
    public EngineResult<SettlementSummary> resolve(String marketId, String outcome, String resolvedBy) {
        if (outcome == null || outcome.isBlank()) {
            return attemptResolve(marketId);
        }
        return resolveByAdmin(marketId, outcome, resolvedBy);
    }

    private EngineResult<SettlementSummary> decide(String marketId,
            Function<Market, EngineResult<SettlementEngine.Finalization>> decision) {
        Optional<Market> found = marketStore.find(marketId);
        if (found.isEmpty()) {
            return EngineResult.failure(ErrorCode.MARKET_NOT_FOUND, "Market not found: " + marketId);
        }
        Market market = found.get();

        EngineResult<SettlementEngine.Finalization> result = lockRegistry.executeWithLock(marketId, () -> {
            lifecycleService.closeIfExpired(market);
            if (market.isHalted()) {
                return EngineResult.failure(ErrorCode.MARKET_HALTED,
                        "Market is halted pending remediation: " + marketId);
            }
            if (market.getStatus() != MarketStatus.ENDED) {
                return EngineResult.failure(ErrorCode.INVALID_TRANSITION,
                        String.format("Market %s is %s, resolution needs ENDED", marketId, market.getStatus()));
            }
            return decision.apply(market);
        });

        if (result.isFailure()) {
            log.warn("Resolution rejected: marketId={}, code={}, reason={}",
                    marketId, result.getError().getCode(), result.getError().getMessage());
            return result.propagate();
        }
        settlementEngine.publish(result.getValue());
        return EngineResult.success(result.getValue().getSummary());
    }

    // Weighted totals in outcome order
    private static Map<String, Long> tally(Market market, List<ResolutionVote> votes) {
        Map<String, Long> totals = new LinkedHashMap<>();
        market.getOutcomes().forEach(o -> totals.put(o, 0L));
        for (ResolutionVote vote : votes) {
            totals.merge(vote.getChosenOutcome(), (long) vote.getWeight(), Long::sum);
        }
        return totals;
    }
}
