package org.javai.notifier.channel;

import org.javai.notifier.settings.Settings;

import java.time.Duration;
import java.util.Objects;

/**
 * A notification channel as stored by the alerting service.
 * Notifiers are built from it once and read their channel-specific options from {@link #settings()}.
 *
 * @param id the channel's numeric identifier
 * @param orgId the owning organization
 * @param uid stable external identifier
 * @param name display name
 * @param type channel type tag, used to pick the {@link NotifierPlugin}
 * @param isDefault whether the channel receives notifications for every rule
 * @param sendReminder whether reminders are sent while a rule keeps alerting
 * @param disableResolveMessage whether resolve notifications are skipped
 * @param frequency minimum interval between reminders
 * @param settings the channel-specific options
 */
public record AlertNotification(
        long id,
        long orgId,
        String uid,
        String name,
        String type,
        boolean isDefault,
        boolean sendReminder,
        boolean disableResolveMessage,
        Duration frequency,
        Settings settings
) {

    public AlertNotification {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        uid = uid == null ? "" : uid;
        frequency = frequency == null ? Duration.ZERO : frequency;
        settings = settings == null ? Settings.empty() : settings;
    }

    public static Builder builder(String name, String type) {
        return new Builder(name, type);
    }

    public static class Builder {
        private final String name;
        private final String type;
        private long id;
        private long orgId;
        private String uid;
        private boolean isDefault;
        private boolean sendReminder;
        private boolean disableResolveMessage;
        private Duration frequency;
        private Settings settings;

        private Builder(String name, String type) {
            this.name = Objects.requireNonNull(name);
            this.type = Objects.requireNonNull(type);
        }

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder orgId(long orgId) {
            this.orgId = orgId;
            return this;
        }

        public Builder uid(String uid) {
            this.uid = uid;
            return this;
        }

        public Builder isDefault(boolean isDefault) {
            this.isDefault = isDefault;
            return this;
        }

        public Builder sendReminder(boolean sendReminder) {
            this.sendReminder = sendReminder;
            return this;
        }

        public Builder disableResolveMessage(boolean disableResolveMessage) {
            this.disableResolveMessage = disableResolveMessage;
            return this;
        }

        public Builder frequency(Duration frequency) {
            this.frequency = frequency;
            return this;
        }

        public Builder settings(Settings settings) {
            this.settings = settings;
            return this;
        }

        public AlertNotification build() {
            return new AlertNotification(id, orgId, uid, name, type, isDefault, sendReminder,
                    disableResolveMessage, frequency, settings);
        }
    }
}
