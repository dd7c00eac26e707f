package com.chainmirror.aggregate;

import com.chainmirror.aggregate.config.AggregateProperties;
import com.chainmirror.coordination.JobLockHandle;
import com.chainmirror.coordination.JobLockService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AggregateUserJobTest {

    @Mock
    private JobLockService jobLockService;
    @Mock
    private AggregateUserService aggregateUserService;

    private AggregateProperties properties;
    private AggregateUserJob job;

    @BeforeEach
    void setUp() {
        properties = new AggregateProperties();
        job = new AggregateUserJob(jobLockService, aggregateUserService, properties);
    }

    @Test
    void lockBusy_skipsRun() {
        when(jobLockService.tryAcquire(eq(AggregateUserJob.LOCK_NAME), any())).thenReturn(Optional.empty());

        assertThat(job.runOnce()).isEmpty();
        verifyNoInteractions(aggregateUserService);
    }

    @Test
    void lockHeld_runsAndReleases() {
        JobLockHandle handle = mock(JobLockHandle.class);
        when(jobLockService.tryAcquire(eq(AggregateUserJob.LOCK_NAME), any())).thenReturn(Optional.of(handle));
        AggregateRunResult expected = new AggregateRunResult(5L, 9L, 3, false);
        when(aggregateUserService.recompute()).thenReturn(expected);

        assertThat(job.runOnce()).contains(expected);
        verify(handle).close();
    }

    @Test
    void failedRun_stillReleasesLock() {
        JobLockHandle handle = mock(JobLockHandle.class);
        when(jobLockService.tryAcquire(eq(AggregateUserJob.LOCK_NAME), any())).thenReturn(Optional.of(handle));
        when(aggregateUserService.recompute()).thenThrow(new IllegalStateException("mongo down"));

        assertThat(job.runOnce()).isEmpty();
        verify(handle).close();
    }

    @Test
    void disabled_scheduledTickDoesNothing() {
        properties.setEnabled(false);

        job.runScheduled();

        verifyNoInteractions(jobLockService);
    }
}
