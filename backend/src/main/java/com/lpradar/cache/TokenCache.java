package com.lpradar.cache;

import com.lpradar.chain.ContractRevertException;
import com.lpradar.chain.contract.Erc20Reader;
import com.lpradar.domain.Token;
import com.lpradar.domain.TokenKey;
import com.lpradar.domain.TokenRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * ERC20 metadata cache. Tokens never change on-chain, so a stored token is never re-read.
 */
@Slf4j
@Component
public class TokenCache extends LazyEntityCache<TokenKey, Token> {

    private final TokenRepository tokenRepository;
    private final Erc20Reader erc20Reader;

    public TokenCache(TokenRepository tokenRepository, Erc20Reader erc20Reader) {
        super(tokenRepository, "token");
        this.tokenRepository = tokenRepository;
        this.erc20Reader = erc20Reader;
    }

    @Override
    protected String idOf(TokenKey key) {
        return key.id();
    }

    @Override
    protected Token hydrate(TokenKey key) {
        try {
            int decimals = erc20Reader.decimals(key.chainId(), key.address());
            String symbol = erc20Reader.symbol(key.chainId(), key.address());
            String name = readName(key, symbol);
            return new Token(key, symbol, name, decimals);
        } catch (ContractRevertException | IllegalStateException | IllegalArgumentException e) {
            throw notFound(key, e.getMessage(), e);
        }
    }

    /** Some tokens do not implement name(); fall back to the symbol. */
    private String readName(TokenKey key, String symbol) {
        try {
            String name = erc20Reader.name(key.chainId(), key.address());
            return name.isEmpty() ? symbol : name;
        } catch (ContractRevertException e) {
            log.debug("name() reverted for {}, using symbol", key);
            return symbol;
        }
    }

    public void evict(TokenKey key) {
        tokenRepository.deleteById(key.id());
        log.info("Evicted token {}", key);
    }

    /** Drop every cached token of a chain. Pools referencing them re-hydrate on next read. */
    public long clear(long chainId) {
        long removed = tokenRepository.deleteByChainId(chainId);
        log.info("Cleared {} tokens of chain {}", removed, chainId);
        return removed;
    }
}
