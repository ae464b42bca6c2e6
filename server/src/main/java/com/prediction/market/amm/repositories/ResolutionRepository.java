package com.prediction.market.amm.repositories;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.prediction.market.amm.entity.Resolution;

@Repository
public interface ResolutionRepository extends MongoRepository<Resolution, String> {
}
