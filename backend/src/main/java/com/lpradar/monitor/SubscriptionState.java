package com.lpradar.monitor;

/**
 * Lifecycle of a pool's swap subscription.
 */
public enum SubscriptionState {
    UNMONITORED,
    SUBSCRIBING,
    ACTIVE,
    UNSUBSCRIBED
}
