package com.prediction.market.amm.repositories;

import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.prediction.market.amm.entity.ResolutionVote;

/**
 * (marketId, voterId) is unique, enforced by the compound index on
 * {@link ResolutionVote}; saving a vote with the same id is an upsert.
 */
@Repository
public interface ResolutionVoteRepository extends MongoRepository<ResolutionVote, String> {
    List<ResolutionVote> findByMarketId(String marketId);
}
