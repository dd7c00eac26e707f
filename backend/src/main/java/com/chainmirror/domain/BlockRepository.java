package com.chainmirror.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for blocks. Reconciliation reads it outside transactions; indexer and revert write it inside them.
 */
public interface BlockRepository extends MongoRepository<Block, String> {

    /** All rows flagged current; callers assert there is exactly one. */
    List<Block> findByCurrentTrue();
}
