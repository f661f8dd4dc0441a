package org.javai.notifier.channel;

import org.javai.notifier.alert.EvaluationOutcome;
import org.javai.notifier.alert.NotificationRecord;

import java.io.IOException;
import java.time.Duration;

/**
 * A notification channel able to decide whether to notify and to send.
 */
public interface Notifier {

    String getType();

    long getNotifierId();

    String getName();

    boolean isDefault();

    /**
     * Whether notifications should carry a rendered image.
     */
    boolean needsImage();

    boolean getSendReminder();

    boolean getDisableResolveMessage();

    Duration getFrequency();

    /**
     * Decides whether this evaluation should be sent on this channel.
     *
     * @param outcome the evaluation that just finished
     * @param record the last notification attempt for the rule on this channel
     * @return true if {@link #notify(EvaluationOutcome)} should be called
     */
    boolean shouldNotify(EvaluationOutcome outcome, NotificationRecord record);

    /**
     * Sends the notification. Synchronous; callers decide on threading and retries.
     *
     * @throws IOException if the channel could not deliver the notification
     */
    void notify(EvaluationOutcome outcome) throws IOException;
}
