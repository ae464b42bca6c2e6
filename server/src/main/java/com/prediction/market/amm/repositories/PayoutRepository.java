package com.prediction.market.amm.repositories;

import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.prediction.market.amm.entity.Payout;

@Repository
public interface PayoutRepository extends MongoRepository<Payout, String> {
    List<Payout> findByMarketId(String marketId);
}
