package com.lpradar.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

/**
 * Store-first cache over a Mongo collection whose entities are hydrated from the chain on a miss.
 * <p>
 * Concurrent misses on one key may each hydrate; the store's unique _id decides which insert wins and
 * every loser re-reads the winner, so all callers observe the same persisted entity. No lock is held
 * across hydration and independent keys never wait for each other.
 *
 * @param <K> parsed key type
 * @param <E> document type
 */
@Slf4j
public abstract class LazyEntityCache<K, E> {

    private final MongoRepository<E, String> repository;
    private final String kind;

    protected LazyEntityCache(MongoRepository<E, String> repository, String kind) {
        this.repository = repository;
        this.kind = kind;
    }

    /**
     * Store lookup only. The entity itself is never fetched remotely; a dependency missing from the
     * store is re-hydrated by {@link #resolve}.
     */
    public Optional<E> get(K key) {
        return repository.findById(idOf(key)).map(this::resolve);
    }

    /**
     * Stored entity for {@code key}, hydrating and persisting it on a miss.
     *
     * @throws EntityNotFoundUpstreamException when the chain has no such entity
     */
    public E fetchOrCreate(K key) {
        String id = idOf(key);
        Optional<E> stored = repository.findById(id);
        if (stored.isPresent()) {
            return resolve(stored.get());
        }
        E hydrated = hydrate(key);
        return resolve(insertOrReread(id, hydrated));
    }

    /**
     * Insert; on a duplicate the concurrently inserted document replaces ours.
     *
     * @throws IllegalStateException when the store reports a duplicate it cannot return
     */
    protected E insertOrReread(String id, E entity) {
        try {
            E saved = repository.insert(entity);
            log.debug("Stored {} {}", kind, id);
            return saved;
        } catch (DuplicateKeyException e) {
            log.debug("{} {} was stored concurrently, re-reading", kind, id);
            return repository.findById(id)
                    .orElseThrow(() -> new IllegalStateException(kind + " " + id + " reported as duplicate but not readable", e));
        }
    }

    protected EntityNotFoundUpstreamException notFound(K key, String reason, Throwable cause) {
        log.warn("Hydration of {} {} failed: {}", kind, idOf(key), reason);
        return new EntityNotFoundUpstreamException(kind, idOf(key), reason, cause);
    }

    protected abstract String idOf(K key);

    /** Remote reads building a new, not yet persisted entity. */
    protected abstract E hydrate(K key);

    /** Attach dependencies. Called on every entity handed out. */
    protected E resolve(E entity) {
        return entity;
    }

    protected String kind() {
        return kind;
    }
}
