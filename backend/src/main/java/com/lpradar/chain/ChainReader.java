package com.lpradar.chain;

import java.util.List;

/**
 * Read-only access to an EVM chain: contract calls, simulated calls, block height and logs.
 * All methods block until the node answers or retries are exhausted.
 */
public interface ChainReader {

    /**
     * {@code eth_call} against the latest block.
     *
     * @return raw result hex (may be {@code 0x} when the target has no code)
     * @throws ContractRevertException when the call reverts
     * @throws RpcException            when the node cannot be reached after retries
     */
    String ethCall(long chainId, String to, String data);

    /**
     * {@code eth_call} sent from {@code from}. Used to simulate state-changing entry points
     * (e.g. {@code collect}) whose authorization checks depend on the caller; nothing is mined.
     */
    String simulate(long chainId, String from, String to, String data);

    long blockNumber(long chainId);

    /**
     * Logs emitted by {@code address} with the given topic0 in the inclusive block range.
     */
    List<LogRecord> getLogs(long chainId, String address, String topic0, long fromBlock, long toBlock);
}
