package com.chainmirror.ingestion.job;

import com.chainmirror.coordination.IndexingStatusPublisher;
import com.chainmirror.domain.Block;
import com.chainmirror.domain.BlockRepository;
import com.chainmirror.ingestion.adapter.ChainBlock;
import com.chainmirror.ingestion.adapter.ChainClient;
import com.chainmirror.ingestion.config.IndexingProperties;
import com.chainmirror.ingestion.reconcile.ChainStateException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Seeds an empty blocks table with the configured start block, otherwise checks that exactly one block is current.
 * Runs at the start of every indexing cycle, under the indexing lock.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BlocksTableInitializer {

    private final BlockRepository blockRepository;
    private final ChainClient chainClient;
    private final IndexingProperties indexingProperties;
    private final IndexingStatusPublisher indexingStatusPublisher;

    /**
     * @return the current block after initialization
     * @throws ChainStateException when blocks exist but none or several are current
     */
    public Block initialize() {
        List<Block> current = blockRepository.findByCurrentTrue();
        if (current.size() > 1) {
            throw new ChainStateException("Found " + current.size() + " current blocks");
        }
        if (current.size() == 1) {
            Block block = current.get(0);
            indexingStatusPublisher.publishIndexedBlock(block.getNumber(), block.getBlockhash());
            return block;
        }
        long existing = blockRepository.count();
        if (existing > 0) {
            throw new ChainStateException("Blocks table has " + existing + " rows but no current block");
        }
        Block seeded = blockRepository.insert(startBlock());
        log.info("Seeded blocks table with start block {} (number {})", seeded.getBlockhash(), seeded.getNumber());
        indexingStatusPublisher.publishIndexedBlock(seeded.getNumber(), seeded.getBlockhash());
        return seeded;
    }

    private Block startBlock() {
        String startHash = indexingProperties.getStartBlock();
        if (startHash == null || startHash.isBlank() || Block.ORIGIN_HASH.equals(startHash)) {
            return new Block(Block.ORIGIN_HASH, null, Block.ORIGIN_HASH, true);
        }
        ChainBlock onChain = chainClient.getBlockByHash(startHash);
        Long number = onChain.number() == 0 ? null : onChain.number();
        return new Block(startHash, number, startHash, true);
    }
}
