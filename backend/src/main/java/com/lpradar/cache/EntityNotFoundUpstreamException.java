package com.lpradar.cache;

import lombok.Getter;

/**
 * Hydration found nothing upstream for a key: empty call result, revert, or a factory lookup that
 * returned the zero address. Nothing is cached for the key.
 */
@Getter
public class EntityNotFoundUpstreamException extends RuntimeException {

    private final String kind;
    private final String key;

    public EntityNotFoundUpstreamException(String kind, String key, String reason) {
        this(kind, key, reason, null);
    }

    public EntityNotFoundUpstreamException(String kind, String key, String reason, Throwable cause) {
        super(kind + " " + key + " not found upstream: " + reason, cause);
        this.kind = kind;
        this.key = key;
    }
}
