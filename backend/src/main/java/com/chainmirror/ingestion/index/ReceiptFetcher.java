package com.chainmirror.ingestion.index;

import com.chainmirror.config.AsyncConfig;
import com.chainmirror.ingestion.adapter.ChainBlock;
import com.chainmirror.ingestion.adapter.ChainClient;
import com.chainmirror.ingestion.adapter.ChainTransaction;
import com.chainmirror.ingestion.adapter.TransactionReceipt;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Fetches every receipt of a block on the bounded receipt pool. All or nothing: one failed or missing receipt
 * fails the whole block.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ReceiptFetcher {

    private final ChainClient chainClient;
    @Qualifier(AsyncConfig.RECEIPT_FETCH_EXECUTOR)
    private final Executor receiptFetchExecutor;

    /**
     * @return receipts keyed by transaction hash, one per transaction of the block
     * @throws ReceiptFetchException when any call fails or fewer receipts than transactions come back
     */
    public Map<String, TransactionReceipt> fetchAll(ChainBlock block) {
        List<ChainTransaction> transactions = block.transactions();
        if (transactions.isEmpty()) {
            return Map.of();
        }
        List<CompletableFuture<TransactionReceipt>> futures = new ArrayList<>(transactions.size());
        for (ChainTransaction tx : transactions) {
            futures.add(CompletableFuture.supplyAsync(() -> chainClient.getTransactionReceipt(tx.hash()), receiptFetchExecutor));
        }
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ReceiptFetchException("Receipt fetch failed for block " + block.number() + " " + block.hash()
                    + ": " + cause.getMessage(), cause);
        }

        Map<String, TransactionReceipt> byHash = new HashMap<>();
        for (CompletableFuture<TransactionReceipt> future : futures) {
            TransactionReceipt receipt = future.join();
            if (receipt != null) {
                byHash.put(receipt.transactionHash(), receipt);
            }
        }
        if (byHash.size() < transactions.size()) {
            throw new ReceiptFetchException("Block " + block.number() + " " + block.hash() + " has "
                    + transactions.size() + " transactions but only " + byHash.size() + " receipts");
        }
        return byHash;
    }
}
