package com.lpradar.common;

import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;

import java.util.function.Supplier;

/**
 * Read-through on a named Spring cache. Loader exceptions reach the caller unwrapped;
 * a missing cache degrades to calling the loader directly.
 */
public final class CachedCall {

    private CachedCall() {
    }

    public static <T> T get(CacheManager cacheManager, String cacheName, Object key, Supplier<T> loader) {
        Cache cache = cacheManager.getCache(cacheName);
        if (cache == null) {
            return loader.get();
        }
        try {
            return cache.get(key, loader::get);
        } catch (Cache.ValueRetrievalException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw e;
        }
    }
}
