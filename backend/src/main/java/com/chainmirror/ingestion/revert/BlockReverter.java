package com.chainmirror.ingestion.revert;

import com.chainmirror.domain.Block;
import com.chainmirror.domain.BlockRepository;
import com.chainmirror.domain.EntityKind;
import com.chainmirror.ingestion.reconcile.ChainStateException;
import com.chainmirror.ingestion.store.VersionLog;
import com.mongodb.client.result.UpdateResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Transactional part of a revert: undoes a whole batch of blocks in one MongoDB transaction.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BlockReverter {

    /** Dependents before the rows they reference. */
    static final List<EntityKind> REVERT_ORDER = List.of(
            EntityKind.SAVE, EntityKind.REPOST, EntityKind.FOLLOW,
            EntityKind.PLAYLIST, EntityKind.TRACK, EntityKind.USER);

    private final VersionLog versionLog;
    private final BlockRepository blockRepository;
    private final MongoTemplate mongoTemplate;

    /**
     * @param blocks most recent first; the first must be the current block
     */
    @Transactional
    public RevertOutcome revertAll(List<Block> blocks) {
        Map<EntityKind, Set<String>> affected = new EnumMap<>(EntityKind.class);
        Block newCurrent = null;
        for (Block listed : blocks) {
            Block block = blockRepository.findById(listed.getBlockhash())
                    .orElseThrow(() -> new ChainStateException("Block to revert is missing: " + listed.getBlockhash()));
            if (!block.isCurrent()) {
                throw new ChainStateException("Block to revert is not current: " + block);
            }
            for (EntityKind kind : REVERT_ORDER) {
                Set<String> ids = versionLog.revertBlock(kind, block.getBlockhash(), block.getNumber());
                if (!ids.isEmpty()) {
                    affected.computeIfAbsent(kind, k -> new LinkedHashSet<>()).addAll(ids);
                }
            }
            newCurrent = makeParentCurrent(block);
            log.debug("Reverted block {} {}", block.getNumber(), block.getBlockhash());
        }
        return new RevertOutcome(blocks.size(), affected, newCurrent);
    }

    private Block makeParentCurrent(Block block) {
        String parentHash = block.effectiveParentHash();
        blockRepository.deleteById(block.getBlockhash());
        UpdateResult result = mongoTemplate.updateFirst(
                new Query(where("_id").is(parentHash)), Update.update("current", true), Block.class);
        if (result.getMatchedCount() != 1) {
            throw new ChainStateException("Parent " + parentHash + " of reverted block " + block.getBlockhash()
                    + " is not in the blocks table");
        }
        return blockRepository.findById(parentHash)
                .orElseThrow(() -> new ChainStateException("Parent " + parentHash + " vanished during revert"));
    }
}
