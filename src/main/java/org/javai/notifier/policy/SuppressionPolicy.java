package org.javai.notifier.policy;

import org.javai.notifier.NotifierConfig;
import org.javai.notifier.alert.AlertState;
import org.javai.notifier.alert.EvaluationOutcome;
import org.javai.notifier.alert.NotificationRecord;
import org.javai.notifier.alert.NotificationState;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Decides whether an evaluation cycle should produce a notification on a channel.
 *
 * <p>The decision is an ordered chain of early-exit guards. The first guard that matches
 * suppresses the notification; a notification is dispatched only when none matches:
 *
 * <ol>
 *   <li>state unchanged and reminders off</li>
 *   <li>state unchanged and reminders on: suppress while the reminder interval has not elapsed,
 *       and always for OK or PENDING; otherwise continue with the guards below</li>
 *   <li>PENDING to OK</li>
 *   <li>OK to PENDING</li>
 *   <li>a pending dispatch claimed less than the debounce window ago</li>
 *   <li>resolved, with resolve messages disabled</li>
 * </ol>
 *
 * <p>The reminder guard can only suppress. A reminder that clears its own checks still has to
 * pass guards 3 to 6.
 *
 * <p>Instances are immutable and safe to share between evaluation workers.
 */
public final class SuppressionPolicy {

    /**
     * How long a PENDING notification record blocks further dispatches.
     */
    public static final Duration DEFAULT_PENDING_DEBOUNCE = Duration.ofMinutes(1);

    private static final SuppressionPolicy DEFAULT = new SuppressionPolicy(DEFAULT_PENDING_DEBOUNCE);

    private final Duration pendingDebounce;

    public SuppressionPolicy(Duration pendingDebounce) {
        Objects.requireNonNull(pendingDebounce, "pendingDebounce must not be null");
        if (pendingDebounce.isNegative()) {
            throw new IllegalArgumentException("pendingDebounce must not be negative");
        }
        this.pendingDebounce = pendingDebounce;
    }

    /**
     * The policy with the one-minute pending debounce window.
     */
    public static SuppressionPolicy defaults() {
        return DEFAULT;
    }

    public Duration pendingDebounce() {
        return pendingDebounce;
    }

    /**
     * Returns true if a notification should be sent.
     *
     * @see #decide(NotifierConfig, EvaluationOutcome, NotificationRecord, Instant)
     */
    public boolean shouldNotify(NotifierConfig config, EvaluationOutcome outcome, NotificationRecord record, Instant now) {
        return decide(config, outcome, record, now).shouldNotify();
    }

    /**
     * Runs the guard chain.
     *
     * @param config the channel's configuration
     * @param outcome the evaluation that just finished
     * @param record the last notification attempt for this rule and channel
     * @param now the current time
     * @return {@link NotifyDecision#dispatch()} or the first matching suppression
     */
    public NotifyDecision decide(NotifierConfig config, EvaluationOutcome outcome, NotificationRecord record, Instant now) {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
        Objects.requireNonNull(record, "record must not be null");
        Objects.requireNonNull(now, "now must not be null");

        AlertState previous = outcome.previousState();
        AlertState current = outcome.currentState();

        if (previous == current && !config.sendReminder()) {
            return NotifyDecision.suppress(SuppressionReason.STATE_UNCHANGED);
        }

        if (previous == current) {
            if (!record.neverUpdated() && withinWindow(record.updatedAt(), config.frequency(), now)) {
                return NotifyDecision.suppress(SuppressionReason.REMINDER_INTERVAL_NOT_ELAPSED);
            }
            if (current == AlertState.OK || current == AlertState.PENDING) {
                return NotifyDecision.suppress(SuppressionReason.REMINDER_FOR_INERT_STATE);
            }
        }

        if (previous == AlertState.PENDING && current == AlertState.OK) {
            return NotifyDecision.suppress(SuppressionReason.PENDING_TO_OK);
        }

        if (previous == AlertState.OK && current == AlertState.PENDING) {
            return NotifyDecision.suppress(SuppressionReason.OK_TO_PENDING);
        }

        if (record.state() == NotificationState.PENDING && withinWindow(record.updatedAt(), pendingDebounce, now)) {
            return NotifyDecision.suppress(SuppressionReason.PENDING_NOTIFICATION_IN_FLIGHT);
        }

        if (current == AlertState.OK && config.disableResolveMessage()) {
            return NotifyDecision.suppress(SuppressionReason.RESOLVE_MESSAGE_DISABLED);
        }

        return NotifyDecision.dispatch();
    }

    // start + window > now, without the overflow Instant.plus would hit for very large windows
    private static boolean withinWindow(Instant start, Duration window, Instant now) {
        return Duration.between(start, now).compareTo(window) < 0;
    }
}
