package com.lpradar.monitor.alert;

import com.lpradar.pricing.Price;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Active price alerts per pool and the last price observed for each pool.
 * <p>
 * An alert fires when the price moves from {@code old < target} to {@code new >= target} (rose above)
 * or from {@code old > target} to {@code new <= target} (fell below). It is removed as it fires, so it
 * fires at most once. A pool without an observed price cannot fire: its first observation only
 * becomes the baseline.
 */
@Slf4j
@Component
public class AlertRegistry {

    private final Map<String, PoolAlerts> pools = new ConcurrentHashMap<>();

    public PriceAlert add(String poolId, BigDecimal targetPrice, String chatKey) {
        Objects.requireNonNull(targetPrice, "targetPrice");
        if (targetPrice.signum() <= 0) {
            throw new IllegalArgumentException("Target price must be positive: " + targetPrice);
        }
        PriceAlert alert = new PriceAlert(poolId, targetPrice, chatKey);
        PoolAlerts entry = pools.computeIfAbsent(poolId, id -> new PoolAlerts());
        synchronized (entry) {
            entry.active.add(alert);
        }
        log.info("Alert {} at {} set on pool {} for {}", alert.getId(), targetPrice, poolId, chatKey);
        return alert;
    }

    public List<PriceAlert> alerts(String poolId) {
        PoolAlerts entry = pools.get(poolId);
        if (entry == null) {
            return List.of();
        }
        synchronized (entry) {
            return List.copyOf(entry.active);
        }
    }

    /**
     * Removes every active alert of {@code chatKey} on the pool.
     *
     * @return number removed
     */
    public int remove(String poolId, String chatKey) {
        PoolAlerts entry = pools.get(poolId);
        if (entry == null) {
            return 0;
        }
        synchronized (entry) {
            int before = entry.active.size();
            entry.active.removeIf(a -> a.getChatKey().equals(chatKey));
            return before - entry.active.size();
        }
    }

    public Optional<Price> lastPrice(String poolId) {
        PoolAlerts entry = pools.get(poolId);
        if (entry == null) {
            return Optional.empty();
        }
        synchronized (entry) {
            return Optional.ofNullable(entry.lastPrice);
        }
    }

    /**
     * Records {@code newPrice} as the pool's latest price and returns the alerts it fired, already removed.
     */
    public List<TriggeredAlert> onPrice(String poolId, Price newPrice) {
        Objects.requireNonNull(newPrice, "newPrice");
        PoolAlerts entry = pools.computeIfAbsent(poolId, id -> new PoolAlerts());
        List<TriggeredAlert> fired = new ArrayList<>();
        synchronized (entry) {
            Price oldPrice = entry.lastPrice;
            entry.lastPrice = newPrice;
            if (oldPrice == null) {
                return fired;
            }
            Iterator<PriceAlert> it = entry.active.iterator();
            while (it.hasNext()) {
                PriceAlert alert = it.next();
                CrossDirection direction = crossing(oldPrice, newPrice, Price.of(alert.getTargetPrice()));
                if (direction != null) {
                    alert.markTriggered();
                    it.remove();
                    fired.add(new TriggeredAlert(alert, direction, oldPrice, newPrice));
                }
            }
        }
        for (TriggeredAlert t : fired) {
            log.info("Alert {} on pool {} triggered: {} {} (now {})", t.alert().getId(), poolId,
                    t.direction().text(), t.alert().getTargetPrice(), newPrice.format());
        }
        return fired;
    }

    /** Drops alerts and baseline of a pool. */
    public void clear(String poolId) {
        pools.remove(poolId);
    }

    static CrossDirection crossing(Price oldPrice, Price newPrice, Price target) {
        if (oldPrice.compareTo(target) < 0 && target.compareTo(newPrice) <= 0) {
            return CrossDirection.ROSE_ABOVE;
        }
        if (oldPrice.compareTo(target) > 0 && target.compareTo(newPrice) >= 0) {
            return CrossDirection.FELL_BELOW;
        }
        return null;
    }

    private static final class PoolAlerts {
        private final List<PriceAlert> active = new ArrayList<>();
        private Price lastPrice;
    }
}
