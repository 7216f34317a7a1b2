package com.lpradar.monitor.notify;

import lombok.extern.slf4j.Slf4j;

/**
 * Sink used when no transport is wired: writes every notification to the log.
 */
@Slf4j
public class LoggingNotificationSink implements NotificationSink {

    @Override
    public void deliver(Notification notification) {
        if (notification.isEdit()) {
            log.info("[{}] edit {}:\n{}", notification.chatKey(), notification.editMessageId(), notification.text());
        } else {
            log.info("[{}] send:\n{}", notification.chatKey(), notification.text());
        }
    }
}
