package com.chainmirror.aggregate;

import com.chainmirror.aggregate.config.AggregateProperties;
import com.chainmirror.coordination.JobLockHandle;
import com.chainmirror.coordination.JobLockService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Scheduled aggregate maintenance, one run per cluster at a time.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AggregateUserJob {

    public static final String LOCK_NAME = "update_aggregate_table:" + AggregateUserService.CHECKPOINT_NAME;

    private final JobLockService jobLockService;
    private final AggregateUserService aggregateUserService;
    private final AggregateProperties aggregateProperties;

    @Scheduled(fixedDelayString = "${chainmirror.aggregate.schedule-interval-ms:10000}")
    public void runScheduled() {
        if (!aggregateProperties.isEnabled()) {
            return;
        }
        runOnce();
    }

    /**
     * @return the run result, or empty when the lock was busy or the run failed
     */
    public Optional<AggregateRunResult> runOnce() {
        Optional<JobLockHandle> lock = jobLockService.tryAcquire(LOCK_NAME, aggregateProperties.getLockTtl());
        if (lock.isEmpty()) {
            log.info("Aggregate user: failed to acquire lock {}", LOCK_NAME);
            return Optional.empty();
        }
        long start = System.currentTimeMillis();
        try (JobLockHandle ignored = lock.get()) {
            AggregateRunResult result = aggregateUserService.recompute();
            log.info("Aggregate user: finished in {} ms", System.currentTimeMillis() - start);
            return Optional.of(result);
        } catch (RuntimeException e) {
            log.error("Aggregate user: run failed: {}", e.getMessage(), e);
            return Optional.empty();
        }
    }
}
