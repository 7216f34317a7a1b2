package com.lpradar.chain.contract;

import com.lpradar.chain.AbiCodec;
import com.lpradar.chain.ChainReader;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * V3 factory {@code getPool(tokenA, tokenB, fee)}.
 */
@Component
@RequiredArgsConstructor
public class PoolFactoryReader {

    private static final String GET_POOL = AbiCodec.selector("getPool(address,address,uint24)");

    private final ChainReader chainReader;

    /**
     * @return pool address (lower-case), empty when the factory has no pool for the pair and fee
     */
    public Optional<String> getPool(long chainId, String factory, String tokenA, String tokenB, int fee) {
        List<String> words = AbiCodec.words(chainReader.ethCall(chainId, factory,
                AbiCodec.encodeCall(GET_POOL, tokenA, tokenB, fee)));
        if (words.isEmpty()) {
            return Optional.empty();
        }
        String address = AbiCodec.decodeAddress(words.get(0));
        return AbiCodec.ZERO_ADDRESS.equals(address) ? Optional.empty() : Optional.of(address);
    }
}
