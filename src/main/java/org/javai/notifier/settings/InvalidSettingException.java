package org.javai.notifier.settings;

/**
 * A setting is present but cannot be read as the requested type.
 */
public class InvalidSettingException extends SettingException {

    public InvalidSettingException(SettingError error) {
        super(error);
    }
}
