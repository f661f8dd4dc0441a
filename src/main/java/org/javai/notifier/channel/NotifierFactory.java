package org.javai.notifier.channel;

/**
 * Builds the notifier for one stored channel.
 */
@FunctionalInterface
public interface NotifierFactory {

    /**
     * @throws org.javai.notifier.settings.SettingException if a required setting is missing or unreadable
     */
    Notifier create(AlertNotification model, NotifierRuntime runtime);
}
