package org.javai.notifier.policy;

/**
 * The guard that suppressed a notification.
 */
public enum SuppressionReason {
    /**
     * State did not change and the channel does not send reminders.
     */
    STATE_UNCHANGED,

    /**
     * State did not change and the reminder interval has not elapsed since the last notification.
     */
    REMINDER_INTERVAL_NOT_ELAPSED,

    /**
     * State did not change and is OK or PENDING, which are never reminded about.
     */
    REMINDER_FOR_INERT_STATE,

    /**
     * The rule resolved from PENDING without ever alerting.
     */
    PENDING_TO_OK,

    /**
     * The rule moved from OK to PENDING.
     */
    OK_TO_PENDING,

    /**
     * A previous dispatch for the pair is still pending and was claimed within the debounce window.
     */
    PENDING_NOTIFICATION_IN_FLIGHT,

    /**
     * The rule resolved and the channel has resolve messages disabled.
     */
    RESOLVE_MESSAGE_DISABLED
}
