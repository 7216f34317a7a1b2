package com.lpradar.monitor;

import com.lpradar.domain.PositionWatch;
import com.lpradar.domain.PositionWatchRepository;
import com.lpradar.monitor.notify.MessageFormatter;
import com.lpradar.monitor.notify.Notification;
import com.lpradar.monitor.notify.NotificationSink;
import lombok.RequiredArgsConstructor;

import java.util.Objects;

/**
 * Keeps a watch's position message current and sends a separate notice when the position leaves
 * or re-enters its range. The status last seen is stored on the watch.
 */
@RequiredArgsConstructor
class PositionMessageUpdater implements PositionListener {

    private final PositionWatch watch;
    private final MessageFormatter messageFormatter;
    private final NotificationSink notificationSink;
    private final PositionWatchRepository positionWatchRepository;

    @Override
    public void onSwap(PositionSwapEvent event) {
        notificationSink.deliver(new Notification(watch.getChatKey(), messageFormatter.positionMessage(event), watch.getMessageId()));
        if (!Objects.equals(watch.getLastInRange(), event.inRange())) {
            watch.setLastInRange(event.inRange());
            positionWatchRepository.save(watch);
        }
    }

    @Override
    public void onRangeChange(PositionSwapEvent event) {
        notificationSink.deliver(Notification.send(watch.getChatKey(), messageFormatter.rangeMessage(event)));
    }
}
