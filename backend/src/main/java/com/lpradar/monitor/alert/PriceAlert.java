package com.lpradar.monitor.alert;

import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One-shot price target on a pool, owned by the chat that set it.
 */
@Getter
public class PriceAlert {

    private final String id;
    private final String poolId;
    private final BigDecimal targetPrice;
    private final String chatKey;
    private final Instant createdAt;
    private volatile boolean triggered;

    public PriceAlert(String poolId, BigDecimal targetPrice, String chatKey) {
        this.id = UUID.randomUUID().toString();
        this.poolId = poolId;
        this.targetPrice = targetPrice;
        this.chatKey = chatKey;
        this.createdAt = Instant.now();
    }

    void markTriggered() {
        this.triggered = true;
    }
}
