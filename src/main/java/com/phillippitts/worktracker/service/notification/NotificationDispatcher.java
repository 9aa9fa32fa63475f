package com.phillippitts.worktracker.service.notification;

/**
 * Outbound user notification channel (push, e-mail, ...).
 *
 * <p>Implementations may block or throw; the engine only calls them through
 * {@link AsyncNotificationPublisher}, which isolates it from both.
 */
public interface NotificationDispatcher {

    /**
     * Sends one notification.
     *
     * @param kind    notification category
     * @param siteId  site the notification concerns
     * @param summary human-readable text
     */
    void notify(NotificationKind kind, String siteId, String summary);
}
