package com.hubsync.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

public interface StreamCheckpointRepository extends MongoRepository<StreamCheckpoint, String> {
}
