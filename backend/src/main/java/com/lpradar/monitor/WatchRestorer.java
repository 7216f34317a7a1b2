package com.lpradar.monitor;

import com.lpradar.config.AsyncConfig;
import com.lpradar.domain.PoolWatch;
import com.lpradar.domain.PoolWatchRepository;
import com.lpradar.domain.PositionWatch;
import com.lpradar.domain.PositionWatchRepository;
import com.lpradar.monitor.config.MonitorProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * On startup re-attaches every persisted pool and position watch. A watch that cannot be restored
 * is logged and left in the store for the next start.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WatchRestorer {

    private final MonitorEngine monitorEngine;
    private final PoolWatchRepository poolWatchRepository;
    private final PositionWatchRepository positionWatchRepository;
    private final MonitorProperties monitorProperties;

    @EventListener(ApplicationReadyEvent.class)
    @Async(AsyncConfig.WATCH_RESTORE_EXECUTOR)
    public void onApplicationReady() {
        if (!monitorProperties.isRestoreOnStartup()) {
            return;
        }
        restoreAll();
    }

    /**
     * @return number of watches re-attached
     */
    public int restoreAll() {
        int restored = 0;
        int failed = 0;
        for (PoolWatch watch : poolWatchRepository.findAll()) {
            try {
                monitorEngine.restore(watch);
                restored++;
            } catch (RuntimeException e) {
                failed++;
                log.warn("Could not restore pool watch {}: {}", watch.getId(), e.getMessage());
            }
        }
        for (PositionWatch watch : positionWatchRepository.findAll()) {
            try {
                monitorEngine.restore(watch);
                restored++;
            } catch (RuntimeException e) {
                failed++;
                log.warn("Could not restore position watch {}: {}", watch.getId(), e.getMessage());
            }
        }
        log.info("Restored {} watches ({} failed)", restored, failed);
        return restored;
    }
}
