package com.lpradar.chain;

import com.lpradar.common.RetryPolicy;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;

/**
 * Round-robin RPC endpoint selection for one chain. Endpoints that answered with a rate-limit
 * are skipped until their cool-down expires, unless every endpoint is cooling down.
 */
public class RpcEndpointRotator {

    private final List<String> endpoints;
    private final AtomicInteger index = new AtomicInteger(0);
    private final RetryPolicy retryPolicy;
    private final Map<String, Long> cooldownUntilMs = new ConcurrentHashMap<>();
    private final LongSupplier clock;

    public RpcEndpointRotator(List<String> endpoints, RetryPolicy retryPolicy) {
        this(endpoints, retryPolicy, System::currentTimeMillis);
    }

    RpcEndpointRotator(List<String> endpoints, RetryPolicy retryPolicy, LongSupplier clock) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new IllegalArgumentException("At least one endpoint required");
        }
        this.endpoints = List.copyOf(endpoints);
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaultPolicy();
        this.clock = clock;
    }

    /**
     * Next endpoint in round-robin order that is not cooling down.
     */
    public String getNextEndpoint() {
        long now = clock.getAsLong();
        String first = null;
        for (int tried = 0; tried < endpoints.size(); tried++) {
            String candidate = endpoints.get(Math.floorMod(index.getAndIncrement(), endpoints.size()));
            if (first == null) {
                first = candidate;
            }
            Long until = cooldownUntilMs.get(candidate);
            if (until == null || until <= now) {
                return candidate;
            }
        }
        return first;
    }

    public void markCoolingDown(String endpoint, long cooldownMs) {
        if (endpoints.contains(endpoint) && cooldownMs > 0) {
            cooldownUntilMs.put(endpoint, clock.getAsLong() + cooldownMs);
        }
    }

    public long retryDelayMs(int attempt) {
        return retryPolicy.delayMs(attempt);
    }

    public int getMaxAttempts() {
        return retryPolicy.getMaxAttempts();
    }

    public List<String> getEndpoints() {
        return endpoints;
    }
}
