package com.chainmirror.ingestion.index;

import com.chainmirror.domain.EntityKind;

import java.util.Map;
import java.util.Set;

/**
 * Committed result of indexing one block.
 */
public record IndexedBlock(long number, String hash, int rowsChanged, Map<EntityKind, Set<String>> affectedIds) {
}
