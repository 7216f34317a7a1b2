package com.lpradar.chain.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * RPC retry policy (exponential backoff ± jitter, capped).
 */
@ConfigurationProperties(prefix = "lpradar.rpc.retry")
@NoArgsConstructor
@Getter
@Setter
public class RpcRetryProperties {

    private long baseDelayMs = 500L;

    private long maxDelayMs = 10_000L;

    /** 0..1, e.g. 0.2 = ±20%. */
    private double jitterFactor = 0.2;

    /** Total attempts including the first call. */
    private int maxAttempts = 4;
}
