package com.chainmirror.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

public interface IndexingCheckpointRepository extends MongoRepository<IndexingCheckpoint, String> {
}
