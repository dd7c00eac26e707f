package com.chainmirror.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Cluster-wide lock per job name. The TTL index removes abandoned locks; JobLockService also takes over a lock
 * whose expiresAt has passed before the TTL monitor runs.
 */
@Document(collection = "job_locks")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class JobLock {

    @Id
    @EqualsAndHashCode.Include
    private String jobName;
    private String owner;
    private Instant acquiredAt;
    @Indexed(expireAfterSeconds = 0)
    private Instant expiresAt;
}
