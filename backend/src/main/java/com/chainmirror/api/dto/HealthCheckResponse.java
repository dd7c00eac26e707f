package com.chainmirror.api.dto;

import com.chainmirror.ingestion.status.HealthReport;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of /health_check and /block_check.
 */
public record HealthCheckResponse(
        DbBlock db,
        WebBlock web,
        @JsonProperty("block_difference") Long blockDifference,
        boolean healthy
) {

    public record DbBlock(Long number, String blockhash) {
    }

    public record WebBlock(Long blocknumber, String blockhash) {
    }

    public static HealthCheckResponse from(HealthReport report) {
        return new HealthCheckResponse(
                new DbBlock(report.dbNumber(), report.dbHash()),
                new WebBlock(report.webNumber(), report.webHash()),
                report.blockDifference(),
                report.healthy());
    }
}
