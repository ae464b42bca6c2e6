package com.prediction.market.amm.repositories;

import java.util.Collection;
import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.prediction.market.amm.entity.Market;
import com.prediction.market.amm.entity.MarketStatus;

@Repository
public interface MarketRepository extends MongoRepository<Market, String> {

    /**
     * Markets still in play; loaded at startup so the sweep can end and refund them.
     */
    List<Market> findByStatusIn(Collection<MarketStatus> statuses);
}
