package com.lpradar.domain;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KeysTest {

    private static final String MIXED_CASE = "0x82aF49447D8a07e3bd95BD0d56f35241523fBab1";

    @Test
    void tokenKey_lowerCasesAddress() {
        TokenKey key = new TokenKey(42161L, MIXED_CASE);

        assertThat(key.id()).isEqualTo("42161:0x82af49447d8a07e3bd95bd0d56f35241523fbab1");
        assertThat(TokenKey.parse(key.id())).isEqualTo(key);
    }

    @Test
    void poolKey_invalidAddress_throws() {
        assertThatThrownBy(() -> new PoolKey(1L, "0x1234")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PoolKey.parse("abc:" + MIXED_CASE)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PoolKey.parse(MIXED_CASE)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void positionKey_parseRoundTrip() {
        PositionKey key = PositionKey.parse("42161:" + MIXED_CASE + ":123456");

        assertThat(key.chainId()).isEqualTo(42161L);
        assertThat(key.tokenId()).isEqualTo(BigInteger.valueOf(123456));
        assertThat(key.id()).isEqualTo("42161:0x82af49447d8a07e3bd95bd0d56f35241523fbab1:123456");
    }

    @Test
    void positionKey_negativeOrNonNumericToken_throws() {
        assertThatThrownBy(() -> new PositionKey(1L, MIXED_CASE, BigInteger.valueOf(-1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PositionKey.parse("1:" + MIXED_CASE + ":x"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void entityKeys_builtFromStoredFields() {
        Pool pool = new Pool();
        pool.setChainId(42161L);
        pool.setAddress("0xc6962004f452be9203591991d15f6b388e09e8d0");
        Position position = new Position();
        position.setChainId(42161L);
        position.setPositionManager("0xc36442b4a4522e871399cd717abdd847ab11fe88");
        position.setTokenId(BigInteger.valueOf(7L));

        assertThat(pool.key().id()).isEqualTo("42161:0xc6962004f452be9203591991d15f6b388e09e8d0");
        assertThat(position.key().id()).isEqualTo("42161:0xc36442b4a4522e871399cd717abdd847ab11fe88:7");
    }
}
