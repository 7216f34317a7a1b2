package com.lpradar.chain.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * JSON-RPC request budget and endpoint cool-down.
 */
@ConfigurationProperties(prefix = "lpradar.rpc")
@NoArgsConstructor
@Getter
@Setter
public class RpcProperties {

    /** Global RPC budget (requests per second) for this process. */
    private int maxRequestsPerSecond = 50;

    /** How long a call may wait for a permit before the attempt counts as failed. */
    private long limiterTimeoutMs = 2_000;

    /** Time to skip an endpoint after a rate-limit answer (HTTP 429). */
    private long endpointCooldownMs = 30_000;
}
