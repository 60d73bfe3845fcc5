package com.vaultledger.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine caches for immutable on-chain metadata. Prices are never cached: every capacity check reads the
 * latest feed answer.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String TOKEN_DECIMALS_CACHE = "tokenDecimalsCache";
    public static final String FEED_DECIMALS_CACHE = "feedDecimalsCache";

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(TOKEN_DECIMALS_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(24, TimeUnit.HOURS)
                .maximumSize(1_000)
                .build());
        manager.registerCustomCache(FEED_DECIMALS_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(24, TimeUnit.HOURS)
                .maximumSize(1_000)
                .build());
        return manager;
    }
}
