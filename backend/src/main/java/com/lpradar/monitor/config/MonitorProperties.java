package com.lpradar.monitor.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Monitoring settings under lpradar.monitor.
 */
@ConfigurationProperties(prefix = "lpradar.monitor")
@Getter
@Setter
public class MonitorProperties {

    /**
     * Zone of the clock shown in swap messages (e.g. "Europe/Berlin").
     */
    private String timezone = "UTC";

    /**
     * Re-attach persisted pool and position watches when the application is ready.
     */
    private boolean restoreOnStartup = true;
}
