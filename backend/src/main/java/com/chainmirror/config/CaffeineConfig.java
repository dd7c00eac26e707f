package com.chainmirror.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process read caches for current entity views. Entries are evicted by
 * {@link com.chainmirror.ingestion.cache.EntityCacheInvalidator} once a block or revert commits.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String USER_CACHE = "userCache";
    public static final String TRACK_CACHE = "trackCache";
    public static final String PLAYLIST_CACHE = "playlistCache";

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(USER_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(5, TimeUnit.MINUTES)
                .maximumSize(10_000)
                .build());
        manager.registerCustomCache(TRACK_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(5, TimeUnit.MINUTES)
                .maximumSize(20_000)
                .build());
        manager.registerCustomCache(PLAYLIST_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(5, TimeUnit.MINUTES)
                .maximumSize(10_000)
                .build());
        return manager;
    }
}
