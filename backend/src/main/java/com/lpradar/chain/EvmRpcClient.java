package com.lpradar.chain;

import reactor.core.publisher.Mono;

/**
 * EVM JSON-RPC transport. Retries and endpoint selection live in {@link JsonRpcChainReader}.
 */
public interface EvmRpcClient {

    /**
     * Perform a single JSON-RPC call.
     *
     * @param endpointUrl RPC endpoint URL
     * @param method      e.g. "eth_call", "eth_getLogs"
     * @param params      positional params
     * @return response body as JSON string; errors with {@link RpcException} on HTTP failure
     */
    Mono<String> call(String endpointUrl, String method, Object params);
}
