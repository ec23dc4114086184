package com.chainexplorer.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface ChainTransactionRepository extends MongoRepository<ChainTransaction, String> {

    List<ChainTransaction> findByBlockHeightOrderByTxIndexAsc(long blockHeight);
}
