package com.lpradar.chain.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * eth_getLogs polling used for event subscriptions.
 */
@ConfigurationProperties(prefix = "lpradar.logs")
@NoArgsConstructor
@Getter
@Setter
public class LogPollingProperties {

    private long pollIntervalMs = 3_000L;

    /** Upper bound of one eth_getLogs window; a lagging subscription catches up in several polls. */
    private int maxBlockRange = 2_000;
}
