package com.chainmirror.api.controller;

import com.chainmirror.api.dto.HealthCheckResponse;
import com.chainmirror.ingestion.status.HealthReport;
import com.chainmirror.ingestion.status.IndexingHealthService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * GET /health_check: indexing lag from the published status; 500 only when enforce_block_diff is set and the lag
 * is too large. GET /block_check: lag measured live against the chain, always enforced.
 * Both read blocking stores, so they run on the bounded elastic scheduler.
 */
@RestController
@RequiredArgsConstructor
public class HealthCheckController {

    private final IndexingHealthService indexingHealthService;

    @GetMapping("/health_check")
    public Mono<ResponseEntity<HealthCheckResponse>> healthCheck(
            @RequestParam(name = "healthy_block_diff", required = false) Long healthyBlockDiff,
            @RequestParam(name = "enforce_block_diff", defaultValue = "false") boolean enforceBlockDiff) {
        long allowed = healthyBlockDiff != null ? healthyBlockDiff : IndexingHealthService.DEFAULT_HEALTHY_BLOCK_DIFF;
        return Mono.fromCallable(() -> indexingHealthService.fromPublishedStatus(allowed))
                .subscribeOn(Schedulers.boundedElastic())
                .map(report -> respond(report, enforceBlockDiff));
    }

    @GetMapping("/block_check")
    public Mono<ResponseEntity<HealthCheckResponse>> blockCheck(
            @RequestParam(name = "healthy_block_diff", required = false) Long healthyBlockDiff) {
        long allowed = healthyBlockDiff != null ? healthyBlockDiff : IndexingHealthService.DEFAULT_HEALTHY_BLOCK_DIFF;
        return Mono.fromCallable(() -> indexingHealthService.live(allowed))
                .subscribeOn(Schedulers.boundedElastic())
                .map(report -> respond(report, true));
    }

    private static ResponseEntity<HealthCheckResponse> respond(HealthReport report, boolean enforce) {
        HttpStatus status = enforce && !report.healthy() ? HttpStatus.INTERNAL_SERVER_ERROR : HttpStatus.OK;
        return ResponseEntity.status(status).body(HealthCheckResponse.from(report));
    }
}
