package com.chainmirror.ingestion.cache;

import com.chainmirror.config.CaffeineConfig;
import com.chainmirror.domain.EntitiesChangedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Evicts cached current views for ids changed by a committed block or revert. Keys are business ids.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EntityCacheInvalidator {

    private final CacheManager cacheManager;

    @EventListener
    public void onEntitiesChanged(EntitiesChangedEvent event) {
        String cacheName = switch (event.kind()) {
            case USER -> CaffeineConfig.USER_CACHE;
            case TRACK -> CaffeineConfig.TRACK_CACHE;
            case PLAYLIST -> CaffeineConfig.PLAYLIST_CACHE;
            default -> null;
        };
        if (cacheName == null) {
            return;
        }
        Cache cache = cacheManager.getCache(cacheName);
        if (cache == null) {
            log.warn("Cache {} not configured; {} dirty ids not evicted", cacheName, event.ids().size());
            return;
        }
        event.ids().forEach(cache::evict);
        log.debug("Evicted {} ids from {}", event.ids().size(), cacheName);
    }
}
