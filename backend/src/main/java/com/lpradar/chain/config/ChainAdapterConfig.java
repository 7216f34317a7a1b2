package com.lpradar.chain.config;

import com.lpradar.chain.EvmRpcClient;
import com.lpradar.chain.RpcEndpointRotator;
import com.lpradar.chain.WebClientEvmRpcClient;
import com.lpradar.common.RetryPolicy;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * RPC plumbing: one endpoint rotator per configured chain, the WebClient transport and the shared rate limiter.
 */
@Configuration
@EnableConfigurationProperties({ ChainProperties.class, RpcProperties.class, RpcRetryProperties.class, LogPollingProperties.class })
public class ChainAdapterConfig {

    @Bean
    public RetryPolicy rpcRetryPolicy(RpcRetryProperties retry) {
        return new RetryPolicy(retry.getBaseDelayMs(), retry.getMaxDelayMs(), retry.getJitterFactor(), retry.getMaxAttempts());
    }

    /** Chains without URLs are left out; calls for them fail fast in the chain reader. */
    @Bean
    public Map<Long, RpcEndpointRotator> rotatorsByChain(ChainProperties properties, RetryPolicy rpcRetryPolicy) {
        return properties.getChains().entrySet().stream()
                .filter(e -> e.getValue() != null && !e.getValue().getUrls().isEmpty())
                .collect(Collectors.toMap(Map.Entry::getKey, e -> new RpcEndpointRotator(e.getValue().getUrls(), rpcRetryPolicy)));
    }

    @Bean
    public EvmRpcClient evmRpcClient(WebClient.Builder webClientBuilder) {
        return new WebClientEvmRpcClient(webClientBuilder);
    }

    @Bean(name = "evmRpcRateLimiter")
    public RateLimiter evmRpcRateLimiter(RpcProperties rpcProperties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, rpcProperties.getMaxRequestsPerSecond()))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, rpcProperties.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("evm-rpc", config);
    }
}
