package com.lpradar.chain.contract;

import com.lpradar.chain.AbiCodec;
import com.lpradar.chain.ChainReader;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * MasterChef V3 style staker: a position NFT is staked when {@code userPositionInfos(tokenId).user}
 * is set, and accrues reward readable through {@code pendingCake(tokenId)}.
 */
@Component
@RequiredArgsConstructor
public class StakerReader {

    private static final String USER_POSITION_INFOS = AbiCodec.selector("userPositionInfos(uint256)");
    private static final String PENDING_CAKE = AbiCodec.selector("pendingCake(uint256)");
    private static final String BALANCE_OF = AbiCodec.selector("balanceOf(address)");
    private static final String TOKEN_OF_OWNER_BY_INDEX = AbiCodec.selector("tokenOfOwnerByIndex(address,uint256)");
    /** liquidity, boostLiquidity, tickLower, tickUpper, rewardGrowthInside, reward, user, pid, boostMultiplier. */
    private static final int USER_WORD = 6;

    private final ChainReader chainReader;

    public boolean isStaked(long chainId, String staker, BigInteger tokenId) {
        return stakedBy(chainId, staker, tokenId).isPresent();
    }

    /**
     * The wallet that staked {@code tokenId}. While staked the NFT itself is owned by the staker contract.
     */
    public Optional<String> stakedBy(long chainId, String staker, BigInteger tokenId) {
        List<String> w = AbiCodec.words(chainReader.ethCall(chainId, staker, AbiCodec.encodeCall(USER_POSITION_INFOS, tokenId)));
        if (w.size() <= USER_WORD) {
            return Optional.empty();
        }
        String user = AbiCodec.decodeAddress(w.get(USER_WORD));
        return AbiCodec.ZERO_ADDRESS.equals(user) ? Optional.empty() : Optional.of(user);
    }

    /** Number of positions {@code user} has staked. */
    public int stakedCount(long chainId, String staker, String user) {
        List<String> w = AbiCodec.words(chainReader.ethCall(chainId, staker, AbiCodec.encodeCall(BALANCE_OF, user)));
        return w.isEmpty() ? 0 : AbiCodec.decodeUint(w.get(0)).intValueExact();
    }

    public BigInteger stakedTokenByIndex(long chainId, String staker, String user, int index) {
        List<String> w = AbiCodec.words(chainReader.ethCall(chainId, staker, AbiCodec.encodeCall(TOKEN_OF_OWNER_BY_INDEX, user, index)));
        if (w.isEmpty()) {
            throw new IllegalStateException("tokenOfOwnerByIndex(" + user + ", " + index + ") returned no data");
        }
        return AbiCodec.decodeUint(w.get(0));
    }

    public BigInteger pendingReward(long chainId, String staker, BigInteger tokenId) {
        List<String> w = AbiCodec.words(chainReader.ethCall(chainId, staker, AbiCodec.encodeCall(PENDING_CAKE, tokenId)));
        return w.isEmpty() ? BigInteger.ZERO : AbiCodec.decodeUint(w.get(0));
    }
}
