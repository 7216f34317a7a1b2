package com.lpradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for Token documents.
 */
public interface TokenRepository extends MongoRepository<Token, String> {

    List<Token> findByChainId(long chainId);

    long deleteByChainId(long chainId);
}
