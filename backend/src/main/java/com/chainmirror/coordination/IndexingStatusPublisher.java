package com.chainmirror.coordination;

import com.chainmirror.domain.IndexingStatus;
import com.chainmirror.domain.IndexingStatusRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Writes the health surface. Indexed-block updates are made only after the block (or revert batch) committed.
 */
@Component
@RequiredArgsConstructor
public class IndexingStatusPublisher {

    private final MongoTemplate mongoTemplate;
    private final IndexingStatusRepository repository;

    public void publishLatestChainBlock(long number, String hash) {
        upsert(new Update()
                .set("latestChainBlockNumber", number)
                .set("latestChainBlockHash", hash));
    }

    public void publishIndexedBlock(Long number, String hash) {
        upsert(new Update()
                .set("lastIndexedBlockNumber", number)
                .set("lastIndexedBlockHash", hash));
    }

    public Optional<IndexingStatus> current() {
        return repository.findById(IndexingStatus.SINGLETON_ID);
    }

    private void upsert(Update update) {
        update.set("updatedAt", Instant.now());
        mongoTemplate.upsert(new Query(where("_id").is(IndexingStatus.SINGLETON_ID)), update, IndexingStatus.class);
    }
}
