package com.chainexplorer.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    /** Node blocks looked up by hash; a hash identifies one immutable block. */
    public static final String NODE_BLOCK_BY_HASH_CACHE = "nodeBlockByHashCache";
    /** Operator status reads, short-lived so the indexer loop is never slowed by dashboards. */
    public static final String INDEXER_STATUS_CACHE = "indexerStatusCache";

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(NODE_BLOCK_BY_HASH_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(10, TimeUnit.MINUTES)
                .maximumSize(1_000)
                .build());
        manager.registerCustomCache(INDEXER_STATUS_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(1, TimeUnit.SECONDS)
                .maximumSize(100)
                .build());
        return manager;
    }
}
