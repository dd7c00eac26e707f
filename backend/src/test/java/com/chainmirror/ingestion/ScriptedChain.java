package com.chainmirror.ingestion;

import com.chainmirror.domain.Block;
import com.chainmirror.ingestion.adapter.ChainBlock;
import com.chainmirror.ingestion.adapter.ChainClient;
import com.chainmirror.ingestion.adapter.ChainTransaction;
import com.chainmirror.ingestion.adapter.ReceiptLog;
import com.chainmirror.ingestion.adapter.RpcException;
import com.chainmirror.ingestion.adapter.TransactionReceipt;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory chain for tests. Keeps every block it was ever given (like a node that still serves orphaned blocks
 * by hash) and a canonical number → block mapping that tests replace to simulate reorgs.
 */
public class ScriptedChain implements ChainClient {

    private final Map<String, ChainBlock> byHash = new ConcurrentHashMap<>();
    private final Map<Long, ChainBlock> canonical = new ConcurrentHashMap<>();
    private final Map<String, TransactionReceipt> receipts = new ConcurrentHashMap<>();
    private final Map<String, ChainBlock> hashOverrides = new ConcurrentHashMap<>();
    private final AtomicInteger receiptCalls = new AtomicInteger();

    public static ChainBlock block(long number, String hash, String parentHash, ChainTransaction... txs) {
        return new ChainBlock(hash, parentHash, number, Instant.ofEpochSecond(1_700_000_000L + number), Arrays.asList(txs));
    }

    /** Genesis at height 0 with the zero-hash parent, followed by children named prefix1, prefix2, ... */
    public static List<ChainBlock> linear(String prefix, int count) {
        List<ChainBlock> blocks = new ArrayList<>();
        String parent = Block.ZERO_HASH;
        for (int i = 0; i < count; i++) {
            String hash = prefix + i;
            blocks.add(block(i, hash, parent));
            parent = hash;
        }
        return blocks;
    }

    /** Makes these blocks canonical at their heights and drops canonical blocks above the last one. */
    public ScriptedChain canonical(List<ChainBlock> blocks) {
        long top = -1;
        for (ChainBlock b : blocks) {
            byHash.put(b.hash(), b);
            canonical.put(b.number(), b);
            top = Math.max(top, b.number());
        }
        long finalTop = top;
        canonical.keySet().removeIf(n -> n > finalTop);
        return this;
    }

    public ScriptedChain canonical(ChainBlock... blocks) {
        return canonical(Arrays.asList(blocks));
    }

    public ScriptedChain receipt(TransactionReceipt receipt) {
        receipts.put(receipt.transactionHash(), receipt);
        return this;
    }

    public static TransactionReceipt receiptFor(ChainBlock block, ChainTransaction tx, String data) {
        return new TransactionReceipt(tx.hash(), block.hash(), block.number(), tx.transactionIndex(), tx.from(), tx.to(),
                true, List.of(new ReceiptLog(tx.to(), List.of("0xevent"), data, 0)));
    }

    /** Next lookup of {@code requestedHash} answers with {@code answer}, as a node on another fork would. */
    public ScriptedChain answerByHash(String requestedHash, ChainBlock answer) {
        hashOverrides.put(requestedHash, answer);
        return this;
    }

    public int receiptCalls() {
        return receiptCalls.get();
    }

    @Override
    public ChainBlock getLatestBlock() {
        long top = canonical.keySet().stream().mapToLong(Long::longValue).max()
                .orElseThrow(() -> new RpcException("empty chain"));
        return canonical.get(top);
    }

    @Override
    public ChainBlock getBlockByNumber(long number) {
        ChainBlock block = canonical.get(number);
        if (block == null) {
            throw new RpcException("Block not found: " + number);
        }
        return block;
    }

    @Override
    public ChainBlock getBlockByHash(String hash) {
        ChainBlock override = hashOverrides.remove(hash);
        if (override != null) {
            return override;
        }
        ChainBlock block = byHash.get(hash);
        if (block == null) {
            throw new RpcException("Block not found: " + hash);
        }
        return block;
    }

    @Override
    public TransactionReceipt getTransactionReceipt(String txHash) {
        receiptCalls.incrementAndGet();
        TransactionReceipt receipt = receipts.get(txHash);
        if (receipt == null) {
            throw new RpcException("eth_getTransactionReceipt no receipt for " + txHash);
        }
        return receipt;
    }
}
