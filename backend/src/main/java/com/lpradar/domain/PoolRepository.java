package com.lpradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

/**
 * Persistence for Pool documents.
 */
public interface PoolRepository extends MongoRepository<Pool, String> {

    Optional<Pool> findByChainIdAndToken0IdAndToken1IdAndFee(long chainId, String token0Id, String token1Id, int fee);
}
