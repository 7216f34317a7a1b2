package com.lpradar.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.cache.CacheManager;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = {
        CaffeineConfig.class,
        AsyncConfig.class
})
class CaffeineConfigTest {

    @Autowired
    CacheManager cacheManager;

    @Autowired
    @Qualifier(AsyncConfig.WATCH_RESTORE_EXECUTOR)
    Executor watchRestoreExecutor;

    @Test
    @DisplayName("all 3 Caffeine caches are created and usable")
    void cachesCreatedAndUsed() {
        assertThat(cacheManager.getCache(CaffeineConfig.SLOT0_CACHE)).isNotNull();
        assertThat(cacheManager.getCache(CaffeineConfig.STAKING_REWARD_CACHE)).isNotNull();
        assertThat(cacheManager.getCache(CaffeineConfig.TOKEN_BALANCE_CACHE)).isNotNull();

        cacheManager.getCache(CaffeineConfig.SLOT0_CACHE).put("42161:0xpool", "slot0");
        assertThat(cacheManager.getCache(CaffeineConfig.SLOT0_CACHE).get("42161:0xpool").get()).isEqualTo("slot0");
    }

    @Test
    @DisplayName("watch restore executor is single threaded")
    void watchRestoreExecutorCreated() {
        assertThat(watchRestoreExecutor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) watchRestoreExecutor;
        assertThat(executor.getCorePoolSize()).isEqualTo(1);
        assertThat(executor.getMaxPoolSize()).isEqualTo(1);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("watch-restore-");
    }
}
