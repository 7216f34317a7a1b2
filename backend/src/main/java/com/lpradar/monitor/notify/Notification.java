package com.lpradar.monitor.notify;

/**
 * Text for a destination. With {@code editMessageId} set, the message with that id is replaced
 * instead of a new one being sent.
 */
public record Notification(String chatKey, String text, String editMessageId) {

    public static Notification send(String chatKey, String text) {
        return new Notification(chatKey, text, null);
    }

    public static Notification edit(String chatKey, String messageId, String text) {
        return new Notification(chatKey, text, messageId);
    }

    public boolean isEdit() {
        return editMessageId != null;
    }
}
