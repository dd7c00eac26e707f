package com.chainmirror.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Last blocknumber fully processed by a job. One document per job name; advanced only after a committed unit of work.
 */
@Document(collection = "indexing_checkpoints")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class IndexingCheckpoint {

    @Id
    @EqualsAndHashCode.Include
    private String jobName;
    private Long lastBlocknumber;
    private Instant updatedAt;
}
