package com.chainmirror.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools. The receipt pool bounds how many eth_getTransactionReceipt calls are in flight for one block.
 */
@Configuration
public class AsyncConfig {

    public static final String RECEIPT_FETCH_EXECUTOR = "receipt-fetch-executor";

    @Bean(name = RECEIPT_FETCH_EXECUTOR)
    public Executor receiptFetchExecutor(
            @Value("${chainmirror.indexing.receipt-fetch-parallelism:5}") int receiptFetchParallelism) {
        int parallelism = Math.max(1, receiptFetchParallelism);
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(parallelism);
        e.setMaxPoolSize(parallelism);
        e.setThreadNamePrefix("receipt-fetch-");
        e.initialize();
        return e;
    }
}
