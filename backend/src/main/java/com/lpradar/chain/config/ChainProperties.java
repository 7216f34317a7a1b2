package com.lpradar.chain.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-chain RPC endpoints and protocol contract addresses. Key = numeric chain id (e.g. 42161).
 */
@ConfigurationProperties(prefix = "lpradar")
@NoArgsConstructor
@Getter
@Setter
public class ChainProperties {

    private Map<Long, ChainEntry> chains = new HashMap<>();

    public void setChains(Map<Long, ChainEntry> chains) {
        this.chains = chains != null ? chains : new HashMap<>();
    }

    /**
     * @throws IllegalArgumentException when the chain is not configured
     */
    public ChainEntry chain(long chainId) {
        ChainEntry entry = chains.get(chainId);
        if (entry == null) {
            throw new IllegalArgumentException("Chain " + chainId + " is not configured");
        }
        return entry;
    }

    /**
     * One chain: RPC URLs plus the concentrated-liquidity deployment on it.
     */
    @NoArgsConstructor
    @Getter
    @Setter
    public static class ChainEntry {

        private List<String> urls = new ArrayList<>();
        /** NonfungiblePositionManager (NFT positions). */
        private String positionManager;
        /** V3 factory, used to resolve pool address from (tokenA, tokenB, fee). */
        private String poolFactory;
        /** MasterChef V3 style staking contract. Optional; when absent nothing is considered staked. */
        private String staker;
        /** Decimals of the staking reward token (CAKE: 18). */
        private int rewardTokenDecimals = 18;
        /** Swap event topic0 (hex), or alias uniswap-v3 / pancakeswap-v3. Null means Uniswap V3 Swap. */
        private String swapEventTopic;
        /** Blocks behind head treated as final when polling logs. */
        private int confirmations = 0;

        public void setUrls(List<String> urls) {
            this.urls = urls != null ? urls : new ArrayList<>();
        }
    }
}
