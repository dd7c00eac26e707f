package com.chainmirror.ingestion.apply;

import com.chainmirror.ingestion.adapter.TransactionReceipt;

import java.time.Instant;
import java.util.List;

/**
 * Turns the receipts of one contract kind in one block into entity versions.
 * Runs inside the block's transaction and writes only through VersionLog; it must not commit, publish
 * or call the chain. Malformed receipts are skipped and logged, and the result counts only what was written.
 * <p>
 * One transaction yields at most one version per entity: when a transaction emits several events for the same
 * entity, each append replaces the previous one, so apply them in log order and carry the merged payload forward.
 */
public interface EntityApplier {

    ContractKind kind();

    ApplyResult apply(List<TransactionReceipt> receipts, long blockNumber, Instant blockTimestamp);
}
