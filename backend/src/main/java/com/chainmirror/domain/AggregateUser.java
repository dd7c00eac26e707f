package com.chainmirror.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Derived per-user counters. Fully recomputed for touched users and overwritten; never versioned.
 */
@Document(collection = "aggregate_user")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class AggregateUser {

    @Id
    @EqualsAndHashCode.Include
    private Long userId;
    private long trackCount;
    private long playlistCount;
    private long albumCount;
    private long followerCount;
    private long followingCount;
    private long repostCount;
    private long trackSaveCount;
}
