package com.chainmirror.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Health surface: latest chain block seen at cycle start and the most recently indexed block.
 * Single document; read by the health check instead of calling the chain.
 */
@Document(collection = "indexing_status")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class IndexingStatus {

    public static final String SINGLETON_ID = "indexing";

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private Long latestChainBlockNumber;
    private String latestChainBlockHash;
    private Long lastIndexedBlockNumber;
    private String lastIndexedBlockHash;
    private Instant updatedAt;
}
