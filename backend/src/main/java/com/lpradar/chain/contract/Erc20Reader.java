package com.lpradar.chain.contract;

import com.lpradar.chain.AbiCodec;
import com.lpradar.chain.ChainReader;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.List;

/**
 * ERC20 metadata and balance reads.
 */
@Component
@RequiredArgsConstructor
public class Erc20Reader {

    private static final String NAME = AbiCodec.selector("name()");
    private static final String SYMBOL = AbiCodec.selector("symbol()");
    private static final String DECIMALS = AbiCodec.selector("decimals()");
    private static final String BALANCE_OF = AbiCodec.selector("balanceOf(address)");

    private final ChainReader chainReader;

    public String name(long chainId, String token) {
        return AbiCodec.decodeString(chainReader.ethCall(chainId, token, NAME));
    }

    public String symbol(long chainId, String token) {
        return AbiCodec.decodeString(chainReader.ethCall(chainId, token, SYMBOL));
    }

    /**
     * @throws IllegalStateException when the address returns no data (not a token contract)
     */
    public int decimals(long chainId, String token) {
        List<String> words = AbiCodec.words(chainReader.ethCall(chainId, token, DECIMALS));
        if (words.isEmpty()) {
            throw new IllegalStateException("decimals() returned no data for " + token);
        }
        return AbiCodec.decodeUint(words.get(0)).intValueExact();
    }

    public BigInteger balanceOf(long chainId, String token, String holder) {
        List<String> words = AbiCodec.words(chainReader.ethCall(chainId, token, AbiCodec.encodeCall(BALANCE_OF, holder)));
        return words.isEmpty() ? BigInteger.ZERO : AbiCodec.decodeUint(words.get(0));
    }
}
