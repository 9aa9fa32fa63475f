package com.phillippitts.worktracker.service.notification;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fire-and-forget bridge from the state machine to the {@link NotificationDispatcher}.
 *
 * <p>Dispatch runs on the {@code notificationExecutor}; failures are logged and never reach
 * the caller, so a broken notification channel cannot block or undo a session transition.
 */
@Component
public class AsyncNotificationPublisher {

    private static final Logger LOG = LogManager.getLogger(AsyncNotificationPublisher.class);

    private final NotificationDispatcher dispatcher;
    private final Executor executor;

    public AsyncNotificationPublisher(NotificationDispatcher dispatcher,
                                      @Qualifier("notificationExecutor") Executor executor) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public void publish(NotificationKind kind, String siteId, String summary) {
        try {
            executor.execute(() -> dispatch(kind, siteId, summary));
        } catch (RejectedExecutionException e) {
            LOG.warn("Notification dropped (executor rejected): kind={}, site={}", kind, siteId);
        }
    }

    private void dispatch(NotificationKind kind, String siteId, String summary) {
        try {
            dispatcher.notify(kind, siteId, summary);
        } catch (RuntimeException e) {
            LOG.warn("Notification failed: kind={}, site={}, error={}", kind, siteId, e.toString());
        }
    }
}
