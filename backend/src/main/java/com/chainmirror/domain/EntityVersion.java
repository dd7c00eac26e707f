package com.chainmirror.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;

import java.time.Instant;

/**
 * One immutable version of a business entity, stamped with the block that produced it.
 * Only {@code current} changes after insert, and only through VersionLog, which keeps it equal to the
 * current_versions pointer for the same business id.
 */
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public abstract class EntityVersion {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String businessId;
    private String blockhash;
    private Long blocknumber;
    private String txHash;
    /** Position of the producing transaction within its block; secondary order after blocknumber. */
    private int txIndex;
    private boolean current;
    private boolean isDelete;
    private Instant createdAt;

    public abstract EntityKind kind();

    /** Business id derived from the payload, e.g. "12" for track 12 or "3:7" for a follow. */
    public abstract String naturalKey();

    public static String versionId(String businessId, String blockhash, int txIndex) {
        return businessId + "@" + blockhash + "#" + txIndex;
    }
}
