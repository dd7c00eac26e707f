package com.chainmirror.ingestion.adapter;

import java.time.Instant;
import java.util.List;

/**
 * Block header plus its transactions as returned by the chain.
 */
public record ChainBlock(
        String hash,
        String parentHash,
        long number,
        Instant timestamp,
        List<ChainTransaction> transactions
) {

    public ChainBlock {
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
    }
}
