package com.chainmirror.ingestion.config;

import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Chain JSON-RPC endpoints and local request budget.
 */
@ConfigurationProperties(prefix = "chainmirror.chain")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class ChainRpcProperties {

    /** Endpoints used round-robin. Empty falls back to a local node. */
    private List<String> urls = new ArrayList<>();

    /** Per-call timeout. A call that exceeds it fails the cycle. */
    @Min(1)
    private long requestTimeoutMs = 10_000;

    /** Local RPC budget (requests per second) for this instance. */
    @Min(1)
    private int maxRequestsPerSecond = 50;

    /** How long the local limiter may wait for a permit before failing the call. */
    private long localLimiterTimeoutMs = 2_000;

    /** Log local limiter waits longer than this threshold. */
    private long localLimiterLogThresholdMs = 100;
}
