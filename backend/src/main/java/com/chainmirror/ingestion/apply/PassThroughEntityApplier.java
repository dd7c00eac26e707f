package com.chainmirror.ingestion.apply;

import com.chainmirror.ingestion.adapter.TransactionReceipt;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;

/**
 * Registered for a contract kind that has no decoder in this deployment; its receipts are dropped.
 */
@Slf4j
public class PassThroughEntityApplier implements EntityApplier {

    private final ContractKind kind;

    public PassThroughEntityApplier(ContractKind kind) {
        this.kind = kind;
    }

    @Override
    public ContractKind kind() {
        return kind;
    }

    @Override
    public ApplyResult apply(List<TransactionReceipt> receipts, long blockNumber, Instant blockTimestamp) {
        if (!receipts.isEmpty()) {
            log.debug("No applier for {}: ignored {} receipts in block {}", kind, receipts.size(), blockNumber);
        }
        return ApplyResult.none();
    }
}
