package com.chainmirror.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for aggregate_user. Written only by AggregateUserService.
 */
public interface AggregateUserRepository extends MongoRepository<AggregateUser, Long> {
}
