package com.lpradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for Position documents.
 */
public interface PositionRepository extends MongoRepository<Position, String> {

    List<Position> findByChainIdAndOwner(long chainId, String owner);
}
