package org.javai.notifier.settings;

/**
 * A required setting is absent.
 */
public class MissingSettingException extends SettingException {

    public MissingSettingException(SettingError error) {
        super(error);
    }
}
