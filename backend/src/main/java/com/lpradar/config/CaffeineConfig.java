package com.lpradar.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Short-lived in-process caches bounding remote reads that callers repeat in bursts.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String SLOT0_CACHE = "slot0Cache";
    public static final String STAKING_REWARD_CACHE = "stakingRewardCache";
    public static final String TOKEN_BALANCE_CACHE = "tokenBalanceCache";

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(SLOT0_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(5, TimeUnit.SECONDS)
                .maximumSize(2_000)
                .build());
        manager.registerCustomCache(STAKING_REWARD_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(60, TimeUnit.SECONDS)
                .maximumSize(5_000)
                .build());
        manager.registerCustomCache(TOKEN_BALANCE_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(15, TimeUnit.SECONDS)
                .maximumSize(5_000)
                .build());
        return manager;
    }
}
