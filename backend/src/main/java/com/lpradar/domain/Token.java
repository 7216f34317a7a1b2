package com.lpradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * ERC20 metadata. Immutable once hydrated; removed only by an explicit cache clear.
 */
@Document(collection = "tokens")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Token {

    /** chainId:address */
    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed
    private long chainId;
    private String address;
    private String symbol;
    private String name;
    private int decimals;
    private Instant createdAt;

    public Token(TokenKey key, String symbol, String name, int decimals) {
        this.id = key.id();
        this.chainId = key.chainId();
        this.address = key.address();
        this.symbol = symbol;
        this.name = name;
        this.decimals = decimals;
        this.createdAt = Instant.now();
    }

    public TokenKey key() {
        return new TokenKey(chainId, address);
    }
}
