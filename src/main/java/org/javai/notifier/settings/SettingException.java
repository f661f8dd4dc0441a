package org.javai.notifier.settings;

/**
 * Thrown when {@link SettingResult#getOrThrow()} is called on a rejected read.
 * A channel that cannot read a required setting is misconfigured.
 */
public class SettingException extends RuntimeException {

    private final SettingError error;

    public SettingException(SettingError error) {
        super(error.message());
        this.error = error;
    }

    public SettingError error() {
        return error;
    }

    public String key() {
        return error.key();
    }
}
