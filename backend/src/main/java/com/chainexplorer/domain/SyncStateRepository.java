package com.chainexplorer.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for the singleton sync_state document (id {@link SyncState#SINGLETON_ID}).
 */
public interface SyncStateRepository extends MongoRepository<SyncState, String> {
}
