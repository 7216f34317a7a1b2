package com.lpradar.chain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lpradar.chain.config.RpcProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * {@link ChainReader} over JSON-RPC. Per-chain endpoint rotation, retry with exponential backoff
 * and a process-wide request budget. Reverts are not retried.
 */
@Slf4j
@Component
public class JsonRpcChainReader implements ChainReader {

    private final EvmRpcClient rpcClient;
    private final Map<Long, RpcEndpointRotator> rotatorsByChain;
    private final RateLimiter rateLimiter;
    private final RpcProperties rpcProperties;
    private final ObjectMapper objectMapper;

    public JsonRpcChainReader(
            EvmRpcClient rpcClient,
            @Qualifier("rotatorsByChain") Map<Long, RpcEndpointRotator> rotatorsByChain,
            @Qualifier("evmRpcRateLimiter") RateLimiter rateLimiter,
            RpcProperties rpcProperties,
            ObjectMapper objectMapper
    ) {
        this.rpcClient = rpcClient;
        this.rotatorsByChain = rotatorsByChain;
        this.rateLimiter = rateLimiter;
        this.rpcProperties = rpcProperties;
        this.objectMapper = objectMapper;
    }

    @Override
    public String ethCall(long chainId, String to, String data) {
        Map<String, Object> tx = Map.of("to", to, "data", data);
        return callWithRetry(chainId, "eth_call", List.of(tx, "latest")).asText();
    }

    @Override
    public String simulate(long chainId, String from, String to, String data) {
        Map<String, Object> tx = new LinkedHashMap<>();
        tx.put("from", from);
        tx.put("to", to);
        tx.put("data", data);
        return callWithRetry(chainId, "eth_call", List.of(tx, "latest")).asText();
    }

    @Override
    public long blockNumber(long chainId) {
        return AbiCodec.hexToLong(callWithRetry(chainId, "eth_blockNumber", List.of()).asText());
    }

    @Override
    public List<LogRecord> getLogs(long chainId, String address, String topic0, long fromBlock, long toBlock) {
        if (fromBlock > toBlock) {
            return List.of();
        }
        Map<String, Object> filter = new LinkedHashMap<>();
        filter.put("address", address);
        filter.put("topics", List.of(topic0));
        filter.put("fromBlock", AbiCodec.toHexQuantity(fromBlock));
        filter.put("toBlock", AbiCodec.toHexQuantity(toBlock));
        JsonNode result = callWithRetry(chainId, "eth_getLogs", List.of(filter));
        List<LogRecord> logs = new ArrayList<>();
        for (JsonNode node : result) {
            logs.add(LogRecord.fromJson(node));
        }
        logs.sort(Comparator.comparingLong(LogRecord::blockNumber).thenComparingLong(LogRecord::logIndex));
        return logs;
    }

    private JsonNode callWithRetry(long chainId, String method, Object params) {
        RpcEndpointRotator rotator = rotatorsByChain.get(chainId);
        if (rotator == null) {
            throw new IllegalArgumentException("No RPC endpoints configured for chain " + chainId);
        }
        Exception lastException = null;
        for (int attempt = 0; attempt < rotator.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                sleep(rotator.retryDelayMs(attempt - 1));
            }
            if (!rateLimiter.acquirePermission()) {
                lastException = new RpcException("Local RPC budget exhausted for " + method);
                continue;
            }
            String endpoint = rotator.getNextEndpoint();
            try {
                String json = rpcClient.call(endpoint, method, params).block();
                return extractResult(json, method);
            } catch (ContractRevertException e) {
                throw e;
            } catch (Exception e) {
                lastException = e;
                if (isRateLimited(e)) {
                    rotator.markCoolingDown(endpoint, rpcProperties.getEndpointCooldownMs());
                }
                log.debug("{} on chain {} via {} failed (attempt {}): {}", method, chainId, endpoint, attempt + 1, messageOf(e));
            }
        }
        log.warn("{} on chain {} failed after {} attempts: {}", method, chainId, rotator.getMaxAttempts(), messageOf(lastException));
        throw new RpcException(method + " failed after " + rotator.getMaxAttempts() + " attempts: " + messageOf(lastException), lastException);
    }

    private JsonNode extractResult(String json, String method) throws Exception {
        if (json == null || json.isBlank()) {
            throw new RpcException("Empty RPC response for " + method);
        }
        JsonNode root = objectMapper.readTree(json);
        JsonNode error = root.get("error");
        if (error != null && !error.isNull()) {
            String message = error.path("message").asText("");
            if (isRevert(error.path("code").asInt(0), message)) {
                throw new ContractRevertException(method + " reverted: " + message);
            }
            throw new RpcException("RPC error for " + method + ": " + error);
        }
        JsonNode result = root.get("result");
        if (result == null || result.isNull()) {
            throw new RpcException("RPC result is null for " + method);
        }
        return result;
    }

    static boolean isRevert(int code, String message) {
        String m = message == null ? "" : message.toLowerCase(Locale.ROOT);
        return code == 3 || m.contains("execution reverted") || m.contains("revert");
    }

    private static boolean isRateLimited(Exception e) {
        String m = messageOf(e).toLowerCase(Locale.ROOT);
        return m.contains("429") || m.contains("rate limit") || m.contains("too many requests");
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(Math.max(0L, millis));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcException("Interrupted during RPC retry", e);
        }
    }

    private static String messageOf(Exception e) {
        if (e == null) {
            return "unknown";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
