package com.chainmirror.ingestion.status;

/**
 * Indexed block ("db") versus chain tip ("web") and whether the gap is within the allowed difference.
 * Numbers are null when unknown; an unknown side is never healthy.
 */
public record HealthReport(
        Long dbNumber,
        String dbHash,
        Long webNumber,
        String webHash,
        Long blockDifference,
        boolean healthy
) {
}
