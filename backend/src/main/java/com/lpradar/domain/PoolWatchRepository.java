package com.lpradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for pool watches.
 */
public interface PoolWatchRepository extends MongoRepository<PoolWatch, String> {

    List<PoolWatch> findByPoolId(String poolId);
}
