package com.prediction.market.amm.cache;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.scheduling.annotation.Scheduled;

import com.prediction.market.amm.entity.ResolutionVote;
import com.prediction.market.amm.repositories.ResolutionVoteRepository;

import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolution votes per market, keyed by voter. Loaded from storage on first
 * access to a market, then kept in memory and written behind.
 */
@Slf4j
public class VoteStore {

    private final ConcurrentHashMap<String, Map<String, ResolutionVote>> votes = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ResolutionVote> dirty = new ConcurrentHashMap<>();
    private final ResolutionVoteRepository voteRepository;
    private final Retry storageRetry;

    public VoteStore(ResolutionVoteRepository voteRepository, Retry storageRetry) {
        this.voteRepository = voteRepository;
        this.storageRetry = storageRetry;
    }

    public Optional<ResolutionVote> find(String marketId, String voterId) {
        return Optional.ofNullable(marketVotes(marketId).get(voterId));
    }

    /**
     * Insert or replace the voter's vote on the market.
     */
    public void upsert(ResolutionVote vote) {
        marketVotes(vote.getMarketId()).put(vote.getVoterId(), vote);
        dirty.put(vote.getId(), vote);
    }

    public List<ResolutionVote> forMarket(String marketId) {
        return new ArrayList<>(marketVotes(marketId).values());
    }

    @Scheduled(fixedDelayString = "${amm.flush-interval-ms:1000}")
    public void flushDirty() {
        List<ResolutionVote> pending = new ArrayList<>(dirty.values());
        if (pending.isEmpty()) {
            return;
        }
        pending.forEach(v -> dirty.remove(v.getId(), v));
        try {
            storageRetry.executeRunnable(() -> voteRepository.saveAll(pending));
            log.debug("Persisted {} votes", pending.size());
        } catch (RuntimeException e) {
            pending.forEach(v -> dirty.putIfAbsent(v.getId(), v));
            log.error("Failed to persist {} votes, will retry", pending.size(), e);
        }
    }

    /**
     * Drop a market's votes from memory. Refused while any is unwritten.
     */
    public boolean evict(String marketId) {
        if (dirty.values().stream().anyMatch(v -> v.getMarketId().equals(marketId))) {
            return false;
        }
        votes.remove(marketId);
        return true;
    }

    private Map<String, ResolutionVote> marketVotes(String marketId) {
        return votes.computeIfAbsent(marketId, id -> {
            Map<String, ResolutionVote> loaded = new ConcurrentHashMap<>();
            for (ResolutionVote vote : voteRepository.findByMarketId(id)) {
                loaded.put(vote.getVoterId(), vote);
            }
            return loaded;
        });
    }
}
