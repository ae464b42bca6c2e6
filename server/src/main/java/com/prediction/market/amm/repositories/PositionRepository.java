package com.prediction.market.amm.repositories;

import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.prediction.market.amm.entity.Position;

@Repository
public interface PositionRepository extends MongoRepository<Position, String> {
    List<Position> findByMarketIdOrderByPlacedAtAsc(String marketId);
}
