package com.lpradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for PositionWatch documents.
 */
public interface PositionWatchRepository extends MongoRepository<PositionWatch, String> {

    List<PositionWatch> findByPositionId(String positionId);
}
