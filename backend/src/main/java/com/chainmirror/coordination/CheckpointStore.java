package com.chainmirror.coordination;

import com.chainmirror.domain.IndexingCheckpoint;
import com.chainmirror.domain.IndexingCheckpointRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;

/**
 * Durable job name → last processed blocknumber. Callers save only after their unit of work committed
 * (or inside the same transaction as that work).
 */
@Service
@RequiredArgsConstructor
public class CheckpointStore {

    private final IndexingCheckpointRepository repository;

    public Optional<Long> get(String jobName) {
        return repository.findById(jobName).map(IndexingCheckpoint::getLastBlocknumber);
    }

    public void save(String jobName, long blocknumber) {
        IndexingCheckpoint checkpoint = repository.findById(jobName).orElseGet(() -> {
            IndexingCheckpoint created = new IndexingCheckpoint();
            created.setJobName(jobName);
            return created;
        });
        checkpoint.setLastBlocknumber(blocknumber);
        checkpoint.setUpdatedAt(Instant.now());
        repository.save(checkpoint);
    }
}
