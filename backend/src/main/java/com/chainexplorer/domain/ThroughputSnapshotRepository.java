package com.chainexplorer.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

public interface ThroughputSnapshotRepository extends MongoRepository<ThroughputSnapshot, String> {
}
