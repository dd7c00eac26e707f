package com.chainmirror.ingestion.adapter;

import reactor.core.publisher.Mono;

/**
 * EVM JSON-RPC transport abstraction, replaced by a stub in tests.
 */
public interface EvmRpcClient {

    /**
     * Perform a single JSON-RPC call. Method and params are standard Ethereum JSON-RPC.
     *
     * @param endpointUrl RPC endpoint URL
     * @param method      e.g. "eth_getBlockByHash"
     * @param params      positional params
     * @return response body as string (JSON); errors on HTTP failure
     */
    Mono<String> call(String endpointUrl, String method, Object params);
}
