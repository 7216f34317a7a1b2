package com.lpradar.common;

import org.junit.jupiter.api.Test;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CachedCallTest {

    @Test
    void get_secondCallServedFromCache() {
        ConcurrentMapCacheManager manager = new ConcurrentMapCacheManager("c");
        AtomicInteger loads = new AtomicInteger();

        assertThat(CachedCall.get(manager, "c", "k", loads::incrementAndGet)).isEqualTo(1);
        assertThat(CachedCall.get(manager, "c", "k", loads::incrementAndGet)).isEqualTo(1);
        assertThat(loads).hasValue(1);
    }

    @Test
    void get_loaderException_reachesCallerUnwrapped() {
        ConcurrentMapCacheManager manager = new ConcurrentMapCacheManager("c");

        assertThatThrownBy(() -> CachedCall.get(manager, "c", "k", () -> {
            throw new IllegalStateException("rpc down");
        })).isExactlyInstanceOf(IllegalStateException.class).hasMessage("rpc down");
    }

    @Test
    void get_unknownCache_callsLoader() {
        ConcurrentMapCacheManager manager = new ConcurrentMapCacheManager("c");

        assertThat(CachedCall.get(manager, "missing", "k", () -> "direct")).isEqualTo("direct");
    }
}
