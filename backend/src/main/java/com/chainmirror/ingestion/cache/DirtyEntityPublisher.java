package com.chainmirror.ingestion.cache;

import com.chainmirror.domain.EntitiesChangedEvent;
import com.chainmirror.domain.EntityKind;
import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Publishes ids whose current view changed. Call only after the writing transaction committed.
 * Only users, tracks and playlists have read caches, so other kinds are not published.
 */
@Component
@RequiredArgsConstructor
public class DirtyEntityPublisher {

    static final Set<EntityKind> CACHED_KINDS = EnumSet.of(EntityKind.USER, EntityKind.TRACK, EntityKind.PLAYLIST);

    private final ApplicationEventPublisher applicationEventPublisher;

    public void publish(Map<EntityKind, Set<String>> idsByKind) {
        idsByKind.forEach((kind, ids) -> {
            if (CACHED_KINDS.contains(kind) && !ids.isEmpty()) {
                applicationEventPublisher.publishEvent(new EntitiesChangedEvent(kind, Set.copyOf(ids)));
            }
        });
    }
}
