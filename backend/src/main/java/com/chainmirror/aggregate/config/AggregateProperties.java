package com.chainmirror.aggregate.config;

import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Aggregate maintenance lock and batching. The job delay ({@code schedule-interval-ms}) is read by
 * {@code @Scheduled} directly.
 */
@ConfigurationProperties(prefix = "chainmirror.aggregate")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class AggregateProperties {

    private boolean enabled = true;

    /** TTL of the aggregate lock. */
    private Duration lockTtl = Duration.ofMinutes(30);

    /** Changed user ids per count query ($in list size). */
    @Min(1)
    private int idBatchSize = 1_000;
}
