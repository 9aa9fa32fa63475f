package com.phillippitts.worktracker.service.notification;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/** Default dispatcher: log-only notification (no device push configured). */
@Component
class LoggingNotificationDispatcher implements NotificationDispatcher {
    private static final Logger LOG = LogManager.getLogger(LoggingNotificationDispatcher.class);

    @Override
    public void notify(NotificationKind kind, String siteId, String summary) {
        LOG.info("Notification: kind={}, site={}, summary='{}'", kind, siteId, summary);
    }
}
