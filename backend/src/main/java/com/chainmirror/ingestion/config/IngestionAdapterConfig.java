package com.chainmirror.ingestion.config;

import com.chainmirror.ingestion.adapter.EvmRpcClient;
import com.chainmirror.ingestion.adapter.RpcEndpointRotator;
import com.chainmirror.ingestion.adapter.WebClientEvmRpcClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;

/**
 * Chain RPC plumbing: endpoint rotator, WebClient JSON-RPC client and the local rate limiter.
 */
@Configuration
@EnableConfigurationProperties({ ChainRpcProperties.class, ContractAddressProperties.class, IndexingProperties.class })
public class IngestionAdapterConfig {

    /** Used when chainmirror.chain.urls is empty, so a local dev node works without configuration. */
    private static final List<String> DEFAULT_FALLBACK_URLS = List.of("http://localhost:8545");

    @Bean(name = "chainRpcEndpointRotator")
    public RpcEndpointRotator chainRpcEndpointRotator(ChainRpcProperties properties) {
        List<String> urls = properties.getUrls();
        if (urls == null || urls.isEmpty()) {
            return new RpcEndpointRotator(DEFAULT_FALLBACK_URLS);
        }
        return new RpcEndpointRotator(urls);
    }

    @Bean
    public EvmRpcClient evmRpcClient(WebClient.Builder webClientBuilder) {
        return new WebClientEvmRpcClient(webClientBuilder);
    }

    @Bean(name = "chainRpcRateLimiter")
    public RateLimiter chainRpcRateLimiter(ChainRpcProperties properties) {
        int rps = Math.max(1, properties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLocalLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("chain-rpc", config);
    }
}
