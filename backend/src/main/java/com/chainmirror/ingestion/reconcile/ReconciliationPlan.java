package com.chainmirror.ingestion.reconcile;

import com.chainmirror.domain.Block;
import com.chainmirror.ingestion.adapter.ChainBlock;

import java.util.List;

/**
 * What one cycle has to do.
 *
 * @param toIndex      canonical blocks after the intersection, ascending by number
 * @param toRevert     persisted blocks no longer canonical, most recent first
 * @param intersection hash of the newest block both the chain and the blocks table agree on
 */
public record ReconciliationPlan(List<ChainBlock> toIndex, List<Block> toRevert, String intersection) {

    public ReconciliationPlan {
        toIndex = List.copyOf(toIndex);
        toRevert = List.copyOf(toRevert);
    }

    public boolean isEmpty() {
        return toIndex.isEmpty() && toRevert.isEmpty();
    }
}
