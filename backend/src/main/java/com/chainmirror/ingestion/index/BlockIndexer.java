package com.chainmirror.ingestion.index;

import com.chainmirror.coordination.IndexingStatusPublisher;
import com.chainmirror.ingestion.adapter.ChainBlock;
import com.chainmirror.ingestion.adapter.ChainTransaction;
import com.chainmirror.ingestion.adapter.TransactionReceipt;
import com.chainmirror.ingestion.apply.ContractClassifier;
import com.chainmirror.ingestion.apply.ContractKind;
import com.chainmirror.ingestion.cache.DirtyEntityPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Applies new canonical blocks one at a time, each in its own transaction.
 * <p>
 * Per block: fetch receipts, order transactions by hash, bucket them by watched contract, then
 * {@link BlockApplier} commits the block. Dirty ids and the indexed block are published after that commit only.
 * The first failing block stops the run; blocks before it stay committed.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BlockIndexer {

    private final ReceiptFetcher receiptFetcher;
    private final BlockApplier blockApplier;
    private final DirtyEntityPublisher dirtyEntityPublisher;
    private final IndexingStatusPublisher indexingStatusPublisher;

    /**
     * @param blocks ascending by number, each the child of the previous one (the first extends the current block)
     * @return committed blocks, in order
     */
    public List<IndexedBlock> index(List<ChainBlock> blocks, ContractClassifier classifier) {
        List<IndexedBlock> indexed = new ArrayList<>(blocks.size());
        for (ChainBlock block : blocks) {
            indexed.add(indexOne(block, classifier));
        }
        return indexed;
    }

    IndexedBlock indexOne(ChainBlock block, ContractClassifier classifier) {
        Map<String, TransactionReceipt> receipts = receiptFetcher.fetchAll(block);

        List<ChainTransaction> sorted = new ArrayList<>(block.transactions());
        sorted.sort(Comparator.comparing(ChainTransaction::hash));

        Map<ContractKind, List<TransactionReceipt>> receiptsByKind = new EnumMap<>(ContractKind.class);
        classifier.bucket(sorted).forEach((kind, txs) -> {
            List<TransactionReceipt> bucket = new ArrayList<>(txs.size());
            for (ChainTransaction tx : txs) {
                TransactionReceipt receipt = receipts.get(tx.hash());
                if (receipt == null) {
                    throw new ReceiptFetchException("No receipt for transaction " + tx.hash() + " in block " + block.number());
                }
                bucket.add(receipt);
            }
            receiptsByKind.put(kind, bucket);
        });

        IndexedBlock result = blockApplier.apply(block, receiptsByKind);

        dirtyEntityPublisher.publish(result.affectedIds());
        indexingStatusPublisher.publishIndexedBlock(result.number(), result.hash());
        log.info("Indexed block {} {} ({} txs, {} rows)", block.number(), block.hash(), block.transactions().size(),
                result.rowsChanged());
        return result;
    }
}
