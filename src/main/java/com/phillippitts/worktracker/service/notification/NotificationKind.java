package com.phillippitts.worktracker.service.notification;

/** User-facing notification categories for committed transitions. */
public enum NotificationKind {
    CLOCKED_IN,
    CLOCKED_OUT,
    /** Clock-out whose duration fell below the minimum; kept for review rather than counted. */
    SHORT_SESSION
}
