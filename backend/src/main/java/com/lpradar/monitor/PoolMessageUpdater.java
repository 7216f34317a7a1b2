package com.lpradar.monitor;

import com.lpradar.domain.PoolWatch;
import com.lpradar.monitor.notify.MessageFormatter;
import com.lpradar.monitor.notify.Notification;
import com.lpradar.monitor.notify.NotificationSink;
import lombok.RequiredArgsConstructor;

/**
 * Rewrites a watch's pool message with price, tick and volume of every swap.
 */
@RequiredArgsConstructor
class PoolMessageUpdater implements PoolListener {

    private final PoolWatch watch;
    private final MessageFormatter messageFormatter;
    private final NotificationSink notificationSink;

    @Override
    public void onSwap(SwapEvent event) {
        notificationSink.deliver(new Notification(watch.getChatKey(), messageFormatter.swapMessage(event), watch.getMessageId()));
    }
}
