package org.javai.notifier;

import java.time.Duration;
import java.util.Objects;

/**
 * The configuration of one notification channel instance, fixed at construction.
 *
 * @param id the channel's numeric identifier
 * @param name display name of the channel
 * @param type channel type tag (e.g., "email", "webhook")
 * @param isDefault whether the channel receives notifications for every rule
 * @param uploadImage whether a rendered panel image should accompany notifications
 * @param sendReminder whether to repeat notifications while a rule stays alerting
 * @param disableResolveMessage whether to skip the notification sent when a rule returns to OK
 * @param frequency minimum interval between reminders; zero or negative means every cycle is due
 */
public record NotifierConfig(
        long id,
        String name,
        String type,
        boolean isDefault,
        boolean uploadImage,
        boolean sendReminder,
        boolean disableResolveMessage,
        Duration frequency
) {

    public NotifierConfig {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        frequency = frequency == null ? Duration.ZERO : frequency;
    }

    public static Builder builder(long id, String name, String type) {
        return new Builder(id, name, type);
    }

    public static class Builder {
        private final long id;
        private final String name;
        private final String type;
        private boolean isDefault;
        private boolean uploadImage = true;
        private boolean sendReminder;
        private boolean disableResolveMessage;
        private Duration frequency = Duration.ZERO;

        private Builder(long id, String name, String type) {
            this.id = id;
            this.name = Objects.requireNonNull(name);
            this.type = Objects.requireNonNull(type);
        }

        public Builder isDefault(boolean isDefault) {
            this.isDefault = isDefault;
            return this;
        }

        public Builder uploadImage(boolean uploadImage) {
            this.uploadImage = uploadImage;
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

        public NotifierConfig build() {
            return new NotifierConfig(id, name, type, isDefault, uploadImage, sendReminder,
                    disableResolveMessage, frequency);
        }
    }
}
