package org.javai.notifier.alert;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Persisted bookkeeping of the last notification attempt for a rule/channel pair.
 *
 * <p>{@code updatedAt} is truncated to whole seconds, the precision it is stored with. {@link Instant#EPOCH}
 * means the record has never been updated; a {@code null} passed to the constructor is normalized to it.
 *
 * @param alertId the rule the record belongs to
 * @param notifierId the channel the record belongs to
 * @param state lifecycle of the last dispatch attempt
 * @param version optimistic-locking version, owned by the persistence layer
 * @param updatedAt when the record was last written
 */
public record NotificationRecord(
        long alertId,
        long notifierId,
        NotificationState state,
        long version,
        Instant updatedAt
) {

    public NotificationRecord {
        Objects.requireNonNull(state, "state must not be null");
        updatedAt = updatedAt == null ? Instant.EPOCH : updatedAt.truncatedTo(ChronoUnit.SECONDS);
    }

    /**
     * A record for a pair that has never been notified.
     */
    public static NotificationRecord never(long alertId, long notifierId) {
        return new NotificationRecord(alertId, notifierId, NotificationState.COMPLETED, 0L, Instant.EPOCH);
    }

    public static NotificationRecord pending(long alertId, long notifierId, Instant updatedAt) {
        return new NotificationRecord(alertId, notifierId, NotificationState.PENDING, 0L, updatedAt);
    }

    public static NotificationRecord completed(long alertId, long notifierId, Instant updatedAt) {
        return new NotificationRecord(alertId, notifierId, NotificationState.COMPLETED, 0L, updatedAt);
    }

    /**
     * Rebuilds a record from its stored form, where {@code updatedAt} is Unix seconds and 0 means never.
     */
    public static NotificationRecord fromStored(long alertId, long notifierId, String state, long version, long updatedAtEpochSeconds) {
        return new NotificationRecord(alertId, notifierId, NotificationState.fromWireName(state), version,
                Instant.ofEpochSecond(updatedAtEpochSeconds));
    }

    public boolean neverUpdated() {
        return Instant.EPOCH.equals(updatedAt);
    }

    public long updatedAtEpochSeconds() {
        return updatedAt.getEpochSecond();
    }
}
