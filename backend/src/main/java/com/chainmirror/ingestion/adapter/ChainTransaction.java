package com.chainmirror.ingestion.adapter;

/**
 * Transaction summary inside a block. {@code to} is null for contract creation.
 */
public record ChainTransaction(String hash, String from, String to, int transactionIndex) {
}
