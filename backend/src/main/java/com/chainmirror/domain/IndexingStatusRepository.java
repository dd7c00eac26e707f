package com.chainmirror.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

public interface IndexingStatusRepository extends MongoRepository<IndexingStatus, String> {
}
