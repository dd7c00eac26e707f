package com.chainmirror.ingestion.index;

import com.chainmirror.domain.Block;
import com.chainmirror.domain.BlockRepository;
import com.chainmirror.domain.EntityKind;
import com.chainmirror.ingestion.adapter.ChainBlock;
import com.chainmirror.ingestion.adapter.TransactionReceipt;
import com.chainmirror.ingestion.apply.ApplyResult;
import com.chainmirror.ingestion.apply.ContractKind;
import com.chainmirror.ingestion.apply.EntityApplier;
import com.chainmirror.ingestion.apply.EntityApplierRegistry;
import com.chainmirror.ingestion.reconcile.ChainStateException;
import com.mongodb.client.result.UpdateResult;
import lombok.RequiredArgsConstructor;
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
 * Transactional part of indexing: moves the current block forward and runs every applier, in one transaction
 * per block.
 */
@Component
@RequiredArgsConstructor
public class BlockApplier {

    private final BlockRepository blockRepository;
    private final MongoTemplate mongoTemplate;
    private final EntityApplierRegistry applierRegistry;

    @Transactional
    public IndexedBlock apply(ChainBlock block, Map<ContractKind, List<TransactionReceipt>> receiptsByKind) {
        List<Block> current = blockRepository.findByCurrentTrue();
        if (current.size() != 1) {
            throw new ChainStateException("Expected exactly one current block before indexing "
                    + block.number() + ", found " + current.size());
        }
        Block previous = current.get(0);
        Block next = new Block(block.hash(), block.number(), block.parentHash(), true);
        if (!previous.getBlockhash().equals(next.effectiveParentHash())) {
            throw new ChainStateException("Block " + block.number() + " " + block.hash() + " does not extend current block "
                    + previous.getBlockhash());
        }

        UpdateResult flipped = mongoTemplate.updateFirst(
                new Query(where("_id").is(previous.getBlockhash()).and("current").is(true)),
                Update.update("current", false), Block.class);
        if (flipped.getModifiedCount() != 1) {
            throw new ChainStateException("Current block " + previous.getBlockhash() + " changed while indexing " + block.hash());
        }
        mongoTemplate.insert(next);

        int rowsChanged = 0;
        Map<EntityKind, Set<String>> affected = new EnumMap<>(EntityKind.class);
        for (EntityApplier applier : applierRegistry.inOrder()) {
            List<TransactionReceipt> receipts = receiptsByKind.getOrDefault(applier.kind(), List.of());
            ApplyResult result = applier.apply(receipts, block.number(), block.timestamp());
            rowsChanged += result.rowsChanged();
            if (result.changed()) {
                result.affectedIds().forEach((kind, ids) ->
                        affected.computeIfAbsent(kind, k -> new LinkedHashSet<>()).addAll(ids));
            }
        }
        return new IndexedBlock(block.number(), block.hash(), rowsChanged, affected);
    }
}
