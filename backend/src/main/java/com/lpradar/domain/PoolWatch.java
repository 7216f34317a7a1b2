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
 * A destination following a pool: the message identified by messageId is edited on every swap.
 * Persisted so monitoring resumes after a restart.
 */
@Document(collection = "pool_watches")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class PoolWatch {

    /** poolId#chatKey */
    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed
    private String poolId;
    private String chatKey;
    private String messageId;
    private Instant createdAt;

    public static String id(String poolId, String chatKey) {
        return poolId + "#" + chatKey;
    }
}
