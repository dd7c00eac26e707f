package com.chainmirror.ingestion.revert;

import com.chainmirror.coordination.IndexingStatusPublisher;
import com.chainmirror.domain.Block;
import com.chainmirror.ingestion.cache.DirtyEntityPublisher;
import com.chainmirror.ingestion.config.IndexingProperties;
import com.chainmirror.ingestion.reconcile.RevertDepthExceededException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Removes persisted state for blocks that left the canonical chain.
 * <p>
 * The batch commits or rolls back as a unit (see {@link BlockReverter}); dirty ids and the new indexed block are
 * published only once it committed. A failure leaves the database as it was and the next cycle reconciles again.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RevertEngine {

    private final BlockReverter blockReverter;
    private final DirtyEntityPublisher dirtyEntityPublisher;
    private final IndexingStatusPublisher indexingStatusPublisher;
    private final IndexingProperties indexingProperties;

    /**
     * @param toRevert most recent first, as produced by reconciliation
     * @return the committed outcome, or empty when there was nothing to revert
     * @throws RevertDepthExceededException when the list is longer than the bound; nothing is changed
     */
    public Optional<RevertOutcome> revert(List<Block> toRevert) {
        if (toRevert.isEmpty()) {
            return Optional.empty();
        }
        int maxDepth = indexingProperties.getMaxRevertDepth();
        if (toRevert.size() > maxDepth) {
            throw new RevertDepthExceededException(toRevert.size(), maxDepth);
        }
        Block first = toRevert.get(0);
        Block last = toRevert.get(toRevert.size() - 1);
        log.info("Reverting {} blocks: {} {} down to {} {}", toRevert.size(),
                first.getNumber(), first.getBlockhash(), last.getNumber(), last.getBlockhash());

        RevertOutcome outcome = blockReverter.revertAll(toRevert);

        dirtyEntityPublisher.publish(outcome.affectedIds());
        Block current = outcome.newCurrent();
        indexingStatusPublisher.publishIndexedBlock(current.getNumber(), current.getBlockhash());
        log.info("Reverted {} blocks; current block is now {} {}, touched kinds {}",
                outcome.revertedBlocks(), current.getNumber(), current.getBlockhash(), outcome.affectedIds().keySet());
        return Optional.of(outcome);
    }
}
