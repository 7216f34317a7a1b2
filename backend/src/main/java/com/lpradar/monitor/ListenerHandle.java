package com.lpradar.monitor;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Detaches one listener. Cancelling twice is a no-op.
 */
public final class ListenerHandle {

    private final Runnable onCancel;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    ListenerHandle(Runnable onCancel) {
        this.onCancel = onCancel;
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            onCancel.run();
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
