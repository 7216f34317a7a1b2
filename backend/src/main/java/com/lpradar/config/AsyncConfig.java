package com.lpradar.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools. Watch restore runs off the startup thread so a slow RPC does not delay readiness.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String WATCH_RESTORE_EXECUTOR = "watch-restore-executor";

    /** Single thread: restores are sequential to stay within provider rate limits. */
    @Bean(name = WATCH_RESTORE_EXECUTOR)
    public Executor watchRestoreExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(1);
        e.setThreadNamePrefix("watch-restore-");
        e.initialize();
        return e;
    }
}
