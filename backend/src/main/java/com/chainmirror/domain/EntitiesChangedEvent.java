package com.chainmirror.domain;

import java.util.Set;

/**
 * Application event: ids of one entity kind whose current version changed in a committed block or revert.
 * Published by ingestion after commit; consumed by read caches.
 */
public record EntitiesChangedEvent(EntityKind kind, Set<String> ids) {
}
