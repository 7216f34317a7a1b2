package com.lpradar.monitor;

import com.lpradar.cache.PoolCache;
import com.lpradar.cache.PositionCache;
import com.lpradar.chain.SwapLog;
import com.lpradar.domain.Pool;
import com.lpradar.domain.PoolKey;
import com.lpradar.domain.PoolWatch;
import com.lpradar.domain.PoolWatchRepository;
import com.lpradar.domain.Position;
import com.lpradar.domain.PositionKey;
import com.lpradar.domain.PositionWatch;
import com.lpradar.domain.PositionWatchRepository;
import com.lpradar.monitor.alert.AlertRegistry;
import com.lpradar.monitor.alert.PriceAlert;
import com.lpradar.monitor.alert.TriggeredAlert;
import com.lpradar.monitor.notify.MessageFormatter;
import com.lpradar.monitor.notify.Notification;
import com.lpradar.monitor.notify.NotificationSink;
import com.lpradar.pricing.LiquidityMath;
import com.lpradar.pricing.Price;
import com.lpradar.pricing.PriceMath;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Swap monitoring per pool. A pool has at most one swap subscription; every swap updates the stored
 * pool, runs alert crossing detection, then fans out to the pool's listeners and position listeners.
 * Listeners outlive a stop/start of their pool and are detached only through their handles.
 * Swaps of one pool are handled one at a time, in block order.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MonitorEngine {

    private final PoolCache poolCache;
    private final PositionCache positionCache;
    private final AlertRegistry alertRegistry;
    private final NotificationSink notificationSink;
    private final MessageFormatter messageFormatter;
    private final PoolWatchRepository poolWatchRepository;
    private final PositionWatchRepository positionWatchRepository;

    private final Map<String, PoolChannel> channels = new ConcurrentHashMap<>();
    private final Map<String, ListenerHandle> watchHandles = new ConcurrentHashMap<>();

    public SubscriptionState startMonitoring(PoolKey key) {
        return startMonitoring(poolCache.fetchOrCreate(key));
    }

    /**
     * Subscribes to the pool's swaps. No-op when already active.
     */
    public SubscriptionState startMonitoring(Pool pool) {
        PoolChannel channel = channels.computeIfAbsent(pool.getId(), id -> new PoolChannel(pool));
        synchronized (channel) {
            if (channel.state == SubscriptionState.ACTIVE) {
                return channel.state;
            }
            SubscriptionState before = channel.state;
            channel.state = SubscriptionState.SUBSCRIBING;
            try {
                channel.subscription = poolCache.watchSwaps(channel.pool, swap -> onSwap(channel, swap));
            } catch (RuntimeException e) {
                channel.state = before;
                log.warn("Subscribing to pool {} failed: {}", pool.getId(), e.getMessage());
                throw e;
            }
            channel.state = SubscriptionState.ACTIVE;
            log.info("Monitoring pool {} ({})", pool.getId(), pool.pairLabel());
            return channel.state;
        }
    }

    /**
     * Releases the pool's subscription. Safe to call for pools never monitored or already stopped.
     */
    public void stopMonitoring(String poolId) {
        PoolChannel channel = channels.get(poolId);
        if (channel == null) {
            return;
        }
        synchronized (channel) {
            if (channel.state != SubscriptionState.ACTIVE) {
                return;
            }
            Disposable subscription = channel.subscription;
            channel.subscription = null;
            channel.state = SubscriptionState.UNSUBSCRIBED;
            if (subscription != null) {
                subscription.dispose();
            }
        }
        log.info("Stopped monitoring pool {}", poolId);
    }

    public void stopMonitoring(PoolKey key) {
        stopMonitoring(key.id());
    }

    public SubscriptionState state(String poolId) {
        PoolChannel channel = channels.get(poolId);
        return channel == null ? SubscriptionState.UNMONITORED : channel.state;
    }

    public List<String> monitoredPools() {
        return channels.values().stream()
                .filter(c -> c.state == SubscriptionState.ACTIVE)
                .map(c -> c.pool.getId())
                .sorted()
                .toList();
    }

    /**
     * Attaches a listener and starts monitoring the pool if needed.
     */
    public ListenerHandle addPoolListener(Pool pool, PoolListener listener) {
        startMonitoring(pool);
        PoolChannel channel = channels.get(pool.getId());
        channel.poolListeners.add(listener);
        return new ListenerHandle(() -> channel.poolListeners.remove(listener));
    }

    /**
     * Attaches a position listener to the position's pool and starts monitoring it if needed.
     *
     * @param lastInRange status already reported to this listener, or null when none was
     */
    public ListenerHandle addPositionListener(Position position, PositionListener listener, Boolean lastInRange) {
        Pool pool = position.getPool();
        startMonitoring(pool);
        PoolChannel channel = channels.get(pool.getId());
        PositionTracker tracker = new PositionTracker(position, listener, lastInRange);
        channel.positionTrackers.add(tracker);
        return new ListenerHandle(() -> channel.positionTrackers.remove(tracker));
    }

    public PriceAlert addAlert(PoolKey key, BigDecimal targetPrice, String chatKey) {
        Pool pool = poolCache.fetchOrCreate(key);
        startMonitoring(pool);
        return alertRegistry.add(pool.getId(), targetPrice, chatKey);
    }

    public List<PriceAlert> alerts(PoolKey key) {
        return alertRegistry.alerts(key.id());
    }

    public int removeAlerts(PoolKey key, String chatKey) {
        int removed = alertRegistry.remove(key.id(), chatKey);
        stopIfIdle(key.id());
        return removed;
    }

    /**
     * Keeps message {@code messageId} of {@code chatKey} updated with every swap of the pool.
     * Watching the same pool again from the same chat replaces the message.
     */
    public PoolWatch watchPool(PoolKey key, String chatKey, String messageId) {
        Pool pool = poolCache.fetchOrCreate(key);
        String id = PoolWatch.id(pool.getId(), chatKey);
        PoolWatch watch = poolWatchRepository.findById(id).orElseGet(() -> {
            PoolWatch created = new PoolWatch();
            created.setId(id);
            created.setPoolId(pool.getId());
            created.setChatKey(chatKey);
            created.setCreatedAt(Instant.now());
            return created;
        });
        watch.setMessageId(messageId);
        PoolWatch saved = poolWatchRepository.save(watch);
        attachPoolWatch(pool, saved);
        return saved;
    }

    public boolean unwatchPool(PoolKey key, String chatKey) {
        String id = PoolWatch.id(key.id(), chatKey);
        boolean attached = detachWatch(id);
        boolean stored = poolWatchRepository.existsById(id);
        if (stored) {
            poolWatchRepository.deleteById(id);
        }
        stopIfIdle(key.id());
        return attached || stored;
    }

    /**
     * Keeps message {@code messageId} updated with the position's status and notifies {@code chatKey}
     * when the position leaves or re-enters its range.
     */
    public PositionWatch watchPosition(PositionKey key, String chatKey, String messageId) {
        Position position = positionCache.fetchOrCreate(key);
        String id = PositionWatch.id(position.getId(), chatKey);
        PositionWatch watch = positionWatchRepository.findById(id).orElseGet(() -> {
            PositionWatch created = new PositionWatch();
            created.setId(id);
            created.setPositionId(position.getId());
            created.setChatKey(chatKey);
            created.setCreatedAt(Instant.now());
            return created;
        });
        watch.setMessageId(messageId);
        PositionWatch saved = positionWatchRepository.save(watch);
        attachPositionWatch(position, saved);
        return saved;
    }

    public boolean unwatchPosition(PositionKey key, String chatKey) {
        String id = PositionWatch.id(key.id(), chatKey);
        boolean attached = detachWatch(id);
        boolean stored = positionWatchRepository.existsById(id);
        if (stored) {
            positionWatchRepository.deleteById(id);
        }
        positionCache.get(key).ifPresent(p -> stopIfIdle(p.getPoolId()));
        return attached || stored;
    }

    /** Re-attaches a persisted pool watch. */
    public void restore(PoolWatch watch) {
        attachPoolWatch(poolCache.fetchOrCreate(PoolKey.parse(watch.getPoolId())), watch);
    }

    /** Re-attaches a persisted position watch, keeping its last reported range status. */
    public void restore(PositionWatch watch) {
        attachPositionWatch(positionCache.fetchOrCreate(PositionKey.parse(watch.getPositionId())), watch);
    }

    @PreDestroy
    public void shutdown() {
        channels.keySet().forEach(this::stopMonitoring);
    }

    private void attachPoolWatch(Pool pool, PoolWatch watch) {
        ListenerHandle handle = addPoolListener(pool, new PoolMessageUpdater(watch, messageFormatter, notificationSink));
        replaceHandle(watch.getId(), handle);
    }

    private void attachPositionWatch(Position position, PositionWatch watch) {
        ListenerHandle handle = addPositionListener(position,
                new PositionMessageUpdater(watch, messageFormatter, notificationSink, positionWatchRepository),
                watch.getLastInRange());
        replaceHandle(watch.getId(), handle);
    }

    private void replaceHandle(String watchId, ListenerHandle handle) {
        ListenerHandle previous = watchHandles.put(watchId, handle);
        if (previous != null) {
            previous.cancel();
        }
    }

    private boolean detachWatch(String watchId) {
        ListenerHandle handle = watchHandles.remove(watchId);
        if (handle == null) {
            return false;
        }
        handle.cancel();
        return true;
    }

    /** Stops a pool nobody listens to and no alert waits on. */
    private void stopIfIdle(String poolId) {
        PoolChannel channel = channels.get(poolId);
        if (channel != null && channel.poolListeners.isEmpty() && channel.positionTrackers.isEmpty()
                && alertRegistry.alerts(poolId).isEmpty()) {
            stopMonitoring(poolId);
        }
    }

    void onSwap(PoolChannel channel, SwapLog swap) {
        if (channel.state != SubscriptionState.ACTIVE) {
            return;
        }
        Pool pool = channel.pool;
        Price price = poolCache.applySwap(pool, swap);
        SwapEvent event = toEvent(pool, swap, price);
        log.debug("Swap on {}: price {} tick {} volume {} {}", pool.getId(), price.format(), swap.tick(),
                event.volume(), event.volumeSymbol());

        for (TriggeredAlert triggered : alertRegistry.onPrice(pool.getId(), price)) {
            deliver(Notification.send(triggered.alert().getChatKey(), messageFormatter.alertMessage(triggered, pool)));
        }
        for (PoolListener listener : channel.poolListeners) {
            try {
                listener.onSwap(event);
            } catch (RuntimeException e) {
                log.warn("Pool listener on {} failed: {}", pool.getId(), e.getMessage(), e);
            }
        }
        for (PositionTracker tracker : channel.positionTrackers) {
            notifyPosition(tracker, pool, event);
        }
    }

    private void notifyPosition(PositionTracker tracker, Pool pool, SwapEvent event) {
        Position position = tracker.position;
        int decimals0 = pool.getToken0().getDecimals();
        int decimals1 = pool.getToken1().getDecimals();
        boolean inRange = PriceMath.inRange(event.tick(), position.getTickLower(), position.getTickUpper());
        PositionSwapEvent positionEvent = new PositionSwapEvent(event, position.getId(), position.getTokenId(),
                position.getTickLower(), position.getTickUpper(),
                PriceMath.tickToPrice(position.getTickLower(), decimals0, decimals1),
                PriceMath.tickToPrice(position.getTickUpper(), decimals0, decimals1),
                inRange);
        Boolean previous = tracker.lastInRange;
        tracker.lastInRange = inRange;
        try {
            tracker.listener.onSwap(positionEvent);
        } catch (RuntimeException e) {
            log.warn("Position listener for {} failed on swap: {}", position.getId(), e.getMessage(), e);
        }
        if (previous != null && previous != inRange) {
            log.info("Position {} is now {}", position.getId(), inRange ? "in range" : "out of range");
            try {
                tracker.listener.onRangeChange(positionEvent);
            } catch (RuntimeException e) {
                log.warn("Position listener for {} failed on range change: {}", position.getId(), e.getMessage(), e);
            }
        }
    }

    private void deliver(Notification notification) {
        try {
            notificationSink.deliver(notification);
        } catch (RuntimeException e) {
            log.warn("Delivering notification to {} failed: {}", notification.chatKey(), e.getMessage(), e);
        }
    }

    static SwapEvent toEvent(Pool pool, SwapLog swap, Price price) {
        boolean token1Moved = swap.amount1().signum() != 0;
        BigInteger rawVolume = (token1Moved ? swap.amount1() : swap.amount0()).abs();
        int decimals = token1Moved ? pool.getToken1().getDecimals() : pool.getToken0().getDecimals();
        String symbol = token1Moved ? pool.getToken1().getSymbol() : pool.getToken0().getSymbol();
        return new SwapEvent(pool.getId(), pool.pairLabel(), price, swap.tick(),
                LiquidityMath.toDecimal(rawVolume, decimals), symbol, swap.liquidity(),
                swap.blockNumber(), swap.transactionHash());
    }

    static final class PoolChannel {
        final Pool pool;
        final List<PoolListener> poolListeners = new CopyOnWriteArrayList<>();
        final List<PositionTracker> positionTrackers = new CopyOnWriteArrayList<>();
        volatile SubscriptionState state = SubscriptionState.UNMONITORED;
        Disposable subscription;

        PoolChannel(Pool pool) {
            this.pool = pool;
        }
    }

    static final class PositionTracker {
        final Position position;
        final PositionListener listener;
        volatile Boolean lastInRange;

        PositionTracker(Position position, PositionListener listener, Boolean lastInRange) {
            this.position = position;
            this.listener = listener;
            this.lastInRange = lastInRange;
        }
    }
}
