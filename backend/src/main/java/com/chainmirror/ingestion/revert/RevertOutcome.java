package com.chainmirror.ingestion.revert;

import com.chainmirror.domain.Block;
import com.chainmirror.domain.EntityKind;

import java.util.Map;
import java.util.Set;

/**
 * Committed result of a revert batch: business ids whose current version changed, and the block now current.
 */
public record RevertOutcome(int revertedBlocks, Map<EntityKind, Set<String>> affectedIds, Block newCurrent) {
}
