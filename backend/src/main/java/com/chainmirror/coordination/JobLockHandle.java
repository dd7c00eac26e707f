package com.chainmirror.coordination;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Held lock. Closing releases it when still owned by this handle; repeated close is a no-op.
 */
public final class JobLockHandle implements AutoCloseable {

    private final JobLockService lockService;
    private final String jobName;
    private final String token;
    private final AtomicBoolean released = new AtomicBoolean(false);

    JobLockHandle(JobLockService lockService, String jobName, String token) {
        this.lockService = lockService;
        this.jobName = jobName;
        this.token = token;
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            lockService.release(jobName, token);
        }
    }
}
