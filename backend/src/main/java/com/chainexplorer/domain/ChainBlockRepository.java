package com.chainexplorer.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Read access to blocks. Writes go through the chain store transaction.
 */
public interface ChainBlockRepository extends MongoRepository<ChainBlock, Long> {

    Optional<ChainBlock> findByHash(String hash);

    Optional<ChainBlock> findTopByOrderByHeightDesc();

    List<ChainBlock> findByTimestampGreaterThanOrderByHeightAsc(long timestamp);
}
