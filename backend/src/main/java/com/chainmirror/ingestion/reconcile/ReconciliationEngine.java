package com.chainmirror.ingestion.reconcile;

import com.chainmirror.domain.Block;
import com.chainmirror.domain.BlockRepository;
import com.chainmirror.ingestion.adapter.ChainBlock;
import com.chainmirror.ingestion.adapter.ChainClient;
import com.chainmirror.ingestion.config.IndexingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Compares the chain with the blocks table and works out which persisted blocks to revert and which chain blocks
 * to index. Read-only: it never writes, so running it twice without chain activity gives the same plan.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ReconciliationEngine {

    private final ChainClient chainClient;
    private final BlockRepository blockRepository;
    private final IndexingProperties indexingProperties;

    /**
     * @param latestChainNumber height of the chain tip observed at cycle start
     * @throws ChainStateException           when not exactly one block is current
     * @throws RevertDepthExceededException  when the fork point is further back than the revert bound
     * @throws ChainViewInconsistentException when the chain changed under the backward walk
     */
    public ReconciliationPlan reconcile(long latestChainNumber) {
        Block current = requireSingleCurrent();
        long currentNumber = current.getNumber() == null ? 0L : current.getNumber();
        long target = Math.min(currentNumber + indexingProperties.getBlockProcessingWindow(), latestChainNumber);

        List<ChainBlock> toIndex = new ArrayList<>();
        String intersection = walkChain(chainClient.getBlockByNumber(target), toIndex);
        Collections.reverse(toIndex);

        List<Block> toRevert = walkBlocksTable(current, intersection);
        if (!toIndex.isEmpty() || !toRevert.isEmpty()) {
            log.info("Reconciled: current={} target={} intersection={} revert={} index={}",
                    currentNumber, target, intersection, toRevert.size(), toIndex.size());
        }
        return new ReconciliationPlan(toIndex, toRevert, intersection);
    }

    /** Tip walk: collects chain blocks newest first until one of them, or its parent, is already persisted. */
    private String walkChain(ChainBlock tip, List<ChainBlock> collected) {
        long maxLength = indexingProperties.getBlockProcessingWindow() + indexingProperties.getMaxRevertDepth() + 1L;
        ChainBlock block = tip;
        while (true) {
            if (blockRepository.existsById(block.hash())) {
                return block.hash();
            }
            collected.add(block);
            String parentHash = block.parentHash();
            if (blockRepository.existsById(parentHash)) {
                return parentHash;
            }
            if (Block.ZERO_HASH.equals(parentHash)) {
                return Block.ORIGIN_HASH;
            }
            if (collected.size() > maxLength) {
                throw new RevertDepthExceededException(collected.size(), indexingProperties.getMaxRevertDepth());
            }
            ChainBlock parent = chainClient.getBlockByHash(parentHash);
            if (!parentHash.equals(parent.hash()) || parent.number() != block.number() - 1) {
                throw new ChainViewInconsistentException("Parent of block " + block.number() + " " + block.hash()
                        + " is " + parentHash + " but chain returned " + parent.number() + " " + parent.hash());
            }
            block = parent;
        }
    }

    /** Revert walk: persisted blocks from the current one back to (excluding) the intersection. */
    private List<Block> walkBlocksTable(Block current, String intersection) {
        int maxDepth = indexingProperties.getMaxRevertDepth();
        List<Block> toRevert = new ArrayList<>();
        Block block = current;
        while (!block.getBlockhash().equals(intersection)) {
            toRevert.add(block);
            if (toRevert.size() > maxDepth) {
                throw new RevertDepthExceededException(toRevert.size(), maxDepth);
            }
            String parentHash = block.effectiveParentHash();
            if (parentHash.equals(block.getBlockhash())) {
                break;
            }
            Optional<Block> parent = blockRepository.findById(parentHash);
            if (parent.isEmpty()) {
                log.warn("Parent {} of persisted block {} is missing; revert walk stops there", parentHash, block.getBlockhash());
                break;
            }
            block = parent.get();
        }
        return toRevert;
    }

    private Block requireSingleCurrent() {
        List<Block> current = blockRepository.findByCurrentTrue();
        if (current.size() != 1) {
            throw new ChainStateException("Expected exactly one current block, found " + current.size());
        }
        return current.get(0);
    }
}
