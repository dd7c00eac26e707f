package com.chainmirror.ingestion.adapter;

/**
 * Read-only access to the chain. Every call either returns a complete value or throws {@link RpcException}.
 *
 * <p>Reconciliation walks parents one call at a time. Implementations must serve those calls from one
 * consistent view of the chain (e.g. a single node, or nodes at the same head); the walk checks hash
 * continuity and fails the cycle when that does not hold.
 */
public interface ChainClient {

    ChainBlock getLatestBlock();

    ChainBlock getBlockByNumber(long number);

    ChainBlock getBlockByHash(String hash);

    TransactionReceipt getTransactionReceipt(String txHash);
}
