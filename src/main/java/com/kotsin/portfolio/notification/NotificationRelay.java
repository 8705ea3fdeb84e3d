package com.kotsin.portfolio.notification;

/**
 * Outbound channel for persistent notifications.
 */
public interface NotificationRelay {

    void send(PersistentNotification notification);
}
