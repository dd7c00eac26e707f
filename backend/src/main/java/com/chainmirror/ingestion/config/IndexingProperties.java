package com.chainmirror.ingestion.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Indexing cycle settings: lock, window and reorg bound.
 * The cycle delay ({@code schedule-interval-ms}) and the receipt pool size ({@code receipt-fetch-parallelism})
 * live under the same prefix but are read by {@code @Scheduled} and the executor config directly.
 */
@ConfigurationProperties(prefix = "chainmirror.indexing")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class IndexingProperties {

    /** Run the scheduled indexing cycle. Tests switch it off and drive the cycle directly. */
    private boolean enabled = true;

    /** TTL of the indexing lock; a holder that dies is taken over after this. */
    private Duration lockTtl = Duration.ofMinutes(10);

    /** Max number of blocks the index list may reach ahead of the current block per cycle. */
    @Min(1)
    private long blockProcessingWindow = 20;

    /** Longest revert list accepted. Deeper reorgs halt the job for manual intervention. */
    @Min(1)
    private int maxRevertDepth = 500;

    /** Hash of the block the blocks table is seeded with when empty; "0x0" means before genesis. */
    @NotBlank
    private String startBlock = "0x0";

    /** Exit the application with a non-zero code on a broken blocks-table invariant or too deep reorg. */
    private boolean exitOnInvariantViolation = false;
}
