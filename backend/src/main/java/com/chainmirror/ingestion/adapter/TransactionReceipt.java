package com.chainmirror.ingestion.adapter;

import java.util.List;

/**
 * Execution outcome of one transaction: status, recipient and emitted logs.
 */
public record TransactionReceipt(
        String transactionHash,
        String blockHash,
        long blockNumber,
        int transactionIndex,
        String from,
        String to,
        boolean success,
        List<ReceiptLog> logs
) {

    public TransactionReceipt {
        logs = logs == null ? List.of() : List.copyOf(logs);
    }
}
