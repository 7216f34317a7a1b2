package com.lpradar.chain.contract;

import com.lpradar.chain.AbiCodec;
import com.lpradar.chain.ChainReader;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.List;

/**
 * NonfungiblePositionManager reads: position data, NFT ownership/enumeration and the simulated
 * {@code collect} used to read uncollected fees.
 */
@Component
@RequiredArgsConstructor
public class PositionManagerReader {

    private static final String POSITIONS = AbiCodec.selector("positions(uint256)");
    private static final String OWNER_OF = AbiCodec.selector("ownerOf(uint256)");
    private static final String BALANCE_OF = AbiCodec.selector("balanceOf(address)");
    private static final String TOKEN_OF_OWNER_BY_INDEX = AbiCodec.selector("tokenOfOwnerByIndex(address,uint256)");
    private static final String COLLECT = AbiCodec.selector("collect((uint256,address,uint128,uint128))");

    private final ChainReader chainReader;

    /**
     * positions(tokenId) returns nonce, operator, token0, token1, fee, tickLower, tickUpper, liquidity,
     * feeGrowthInside0LastX128, feeGrowthInside1LastX128, tokensOwed0, tokensOwed1.
     *
     * @throws IllegalStateException when the result is shorter than the struct
     */
    public PositionData positions(long chainId, String manager, BigInteger tokenId) {
        List<String> w = AbiCodec.words(chainReader.ethCall(chainId, manager, AbiCodec.encodeCall(POSITIONS, tokenId)));
        if (w.size() < 12) {
            throw new IllegalStateException("positions(" + tokenId + ") returned " + w.size() + " words");
        }
        return new PositionData(
                AbiCodec.decodeAddress(w.get(2)),
                AbiCodec.decodeAddress(w.get(3)),
                AbiCodec.decodeUint(w.get(4)).intValueExact(),
                AbiCodec.decodeInt(w.get(5)).intValueExact(),
                AbiCodec.decodeInt(w.get(6)).intValueExact(),
                AbiCodec.decodeUint(w.get(7)),
                AbiCodec.decodeUint(w.get(10)),
                AbiCodec.decodeUint(w.get(11))
        );
    }

    public String ownerOf(long chainId, String manager, BigInteger tokenId) {
        return AbiCodec.decodeAddress(single(chainReader.ethCall(chainId, manager, AbiCodec.encodeCall(OWNER_OF, tokenId)), "ownerOf"));
    }

    public int balanceOf(long chainId, String manager, String owner) {
        return AbiCodec.decodeUint(single(chainReader.ethCall(chainId, manager, AbiCodec.encodeCall(BALANCE_OF, owner)), "balanceOf"))
                .intValueExact();
    }

    public BigInteger tokenOfOwnerByIndex(long chainId, String manager, String owner, int index) {
        return AbiCodec.decodeUint(single(chainReader.ethCall(chainId, manager,
                AbiCodec.encodeCall(TOKEN_OF_OWNER_BY_INDEX, owner, index)), "tokenOfOwnerByIndex"));
    }

    /**
     * Simulates {@code collect} with both maxima at uint128 max, sent from the NFT holder, so the result is
     * every fee accrued and not yet collected. Nothing is mined. {@code holder} must be the address that
     * holds the NFT or the manager rejects the call as unauthorised.
     */
    public CollectAmounts simulateCollect(long chainId, String manager, BigInteger tokenId, String holder) {
        String data = AbiCodec.encodeCall(COLLECT, tokenId, holder, AbiCodec.MAX_UINT128, AbiCodec.MAX_UINT128);
        List<String> w = AbiCodec.words(chainReader.simulate(chainId, holder, manager, data));
        if (w.size() < 2) {
            throw new IllegalStateException("collect simulation returned " + w.size() + " words");
        }
        return new CollectAmounts(AbiCodec.decodeUint(w.get(0)), AbiCodec.decodeUint(w.get(1)));
    }

    private static String single(String hex, String method) {
        List<String> w = AbiCodec.words(hex);
        if (w.isEmpty()) {
            throw new IllegalStateException(method + " returned no data");
        }
        return w.get(0);
    }

    public record PositionData(
            String token0,
            String token1,
            int fee,
            int tickLower,
            int tickUpper,
            BigInteger liquidity,
            BigInteger tokensOwed0,
            BigInteger tokensOwed1
    ) {
    }

    public record CollectAmounts(BigInteger amount0, BigInteger amount1) {
    }
}
