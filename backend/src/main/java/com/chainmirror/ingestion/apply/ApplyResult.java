package com.chainmirror.ingestion.apply;

import com.chainmirror.domain.EntityKind;

import java.util.Map;
import java.util.Set;

/**
 * Outcome of one applier on one block: number of version rows written and the business ids touched per kind.
 */
public record ApplyResult(int rowsChanged, Map<EntityKind, Set<String>> affectedIds) {

    private static final ApplyResult NONE = new ApplyResult(0, Map.of());

    public ApplyResult {
        affectedIds = affectedIds == null ? Map.of() : Map.copyOf(affectedIds);
    }

    public static ApplyResult none() {
        return NONE;
    }

    public boolean changed() {
        return rowsChanged > 0;
    }
}
