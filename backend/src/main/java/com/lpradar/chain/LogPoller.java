package com.lpradar.chain;

import com.lpradar.chain.config.ChainProperties;
import com.lpradar.chain.config.LogPollingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

/**
 * Log subscription on top of eth_getLogs polling. Each subscription keeps its own block cursor,
 * starts at the block after the current head and delivers logs in (block, logIndex) order on a
 * single sequence, so one subscription never processes two logs concurrently.
 */
@Slf4j
@Component
public class LogPoller {

    private final ChainReader chainReader;
    private final ChainProperties chainProperties;
    private final LogPollingProperties pollingProperties;
    private final Scheduler scheduler;

    @Autowired
    public LogPoller(ChainReader chainReader, ChainProperties chainProperties, LogPollingProperties pollingProperties) {
        this(chainReader, chainProperties, pollingProperties, Schedulers.boundedElastic());
    }

    LogPoller(ChainReader chainReader, ChainProperties chainProperties, LogPollingProperties pollingProperties, Scheduler scheduler) {
        this.chainReader = chainReader;
        this.chainProperties = chainProperties;
        this.pollingProperties = pollingProperties;
        this.scheduler = scheduler;
    }

    /**
     * Subscribe to logs of {@code address} with {@code topic0}. Consumer exceptions are logged and the
     * log skipped; poll failures are logged and the same block range is retried on the next tick.
     *
     * @return handle whose {@code dispose()} stops polling; disposing twice is a no-op
     */
    public Disposable subscribe(long chainId, String address, String topic0, Consumer<LogRecord> consumer) {
        int confirmations = chainProperties.chain(chainId).getConfirmations();
        LogCursor cursor = new LogCursor(chainId, address, topic0, confirmations);
        Duration interval = Duration.ofMillis(Math.max(100L, pollingProperties.getPollIntervalMs()));
        return Flux.interval(Duration.ZERO, interval, scheduler)
                .onBackpressureDrop()
                .concatMap(tick -> Mono.fromCallable(() -> poll(cursor))
                        .onErrorResume(e -> {
                            log.warn("Log poll for {} on chain {} failed: {}", address, chainId, e.getMessage());
                            return Mono.just(List.of());
                        }))
                .flatMapIterable(logs -> logs)
                .subscribe(record -> deliver(consumer, record),
                        e -> log.error("Log subscription for {} on chain {} terminated", address, chainId, e));
    }

    /**
     * One poll step: reads logs between the cursor and the confirmed head, then advances the cursor.
     * The first call only positions the cursor.
     */
    List<LogRecord> poll(LogCursor cursor) {
        long head = chainReader.blockNumber(cursor.chainId) - cursor.confirmations;
        if (cursor.nextBlock < 0) {
            cursor.nextBlock = head + 1;
            return List.of();
        }
        if (head < cursor.nextBlock) {
            return List.of();
        }
        long to = Math.min(head, cursor.nextBlock + Math.max(1, pollingProperties.getMaxBlockRange()) - 1);
        List<LogRecord> logs = chainReader.getLogs(cursor.chainId, cursor.address, cursor.topic0, cursor.nextBlock, to);
        cursor.nextBlock = to + 1;
        return logs.stream().filter(l -> !l.removed()).toList();
    }

    private void deliver(Consumer<LogRecord> consumer, LogRecord record) {
        try {
            consumer.accept(record);
        } catch (Exception e) {
            log.warn("Skipping log {}#{} of {}: {}", record.transactionHash(), record.logIndex(), record.address(), e.getMessage(), e);
        }
    }

    static final class LogCursor {
        final long chainId;
        final String address;
        final String topic0;
        final int confirmations;
        long nextBlock = -1;

        LogCursor(long chainId, String address, String topic0, int confirmations) {
            this.chainId = chainId;
            this.address = address;
            this.topic0 = topic0;
            this.confirmations = Math.max(0, confirmations);
        }
    }
}
