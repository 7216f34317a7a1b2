package com.lpradar.monitor.notify;

/**
 * Delivery of rendered notifications. The transport (chat bot, webhook) lives outside this service.
 */
public interface NotificationSink {

    void deliver(Notification notification);
}
