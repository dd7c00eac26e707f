package com.chainmirror.coordination;

import com.chainmirror.domain.JobLock;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.UpdateResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Non-blocking TTL lock per job name, shared by every instance pointing at the same database.
 * Acquire either inserts the lock document or takes over one whose TTL has passed; it never waits.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class JobLockService {

    private final MongoTemplate mongoTemplate;

    /**
     * Try to take the lock once.
     *
     * @return a handle to close on every exit path, or empty when another owner holds a live lock
     */
    public Optional<JobLockHandle> tryAcquire(String jobName, Duration ttl) {
        String token = UUID.randomUUID().toString();
        Instant now = Instant.now();
        JobLock lock = new JobLock();
        lock.setJobName(jobName);
        lock.setOwner(token);
        lock.setAcquiredAt(now);
        lock.setExpiresAt(now.plus(ttl));
        try {
            mongoTemplate.insert(lock);
            log.debug("Acquired lock {} (ttl {})", jobName, ttl);
            return Optional.of(new JobLockHandle(this, jobName, token));
        } catch (DuplicateKeyException held) {
            return takeOverExpired(jobName, token, now, ttl);
        }
    }

    private Optional<JobLockHandle> takeOverExpired(String jobName, String token, Instant now, Duration ttl) {
        Query expired = new Query(where("_id").is(jobName).and("expiresAt").lt(now));
        Update update = new Update()
                .set("owner", token)
                .set("acquiredAt", now)
                .set("expiresAt", now.plus(ttl));
        UpdateResult result = mongoTemplate.updateFirst(expired, update, JobLock.class);
        if (result.getModifiedCount() == 1) {
            log.warn("Took over expired lock {}; previous holder exceeded its ttl", jobName);
            return Optional.of(new JobLockHandle(this, jobName, token));
        }
        return Optional.empty();
    }

    void release(String jobName, String token) {
        DeleteResult result = mongoTemplate.remove(
                new Query(where("_id").is(jobName).and("owner").is(token)), JobLock.class);
        if (result.getDeletedCount() == 0) {
            log.warn("Lock {} was no longer held by this owner at release", jobName);
        } else {
            log.debug("Released lock {}", jobName);
        }
    }
}
