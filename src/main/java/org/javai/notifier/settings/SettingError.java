package org.javai.notifier.settings;

import java.util.Objects;

/**
 * Describes a failed settings read.
 *
 * @param kind whether the key was missing or held an unusable value
 * @param key the offending key
 * @param message human-readable description, always naming the key
 */
public record SettingError(SettingErrorKind kind, String key, String message) {

    public SettingError {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public static SettingError missing(String key) {
        return new SettingError(SettingErrorKind.MISSING, key, "Could not find " + key + " property in settings");
    }

    public static SettingError invalid(String key) {
        return new SettingError(SettingErrorKind.INVALID, key, "Invalid " + key + " property in settings");
    }

    /**
     * Converts this error into the matching unchecked exception.
     */
    public SettingException toException() {
        return switch (kind) {
            case MISSING -> new MissingSettingException(this);
            case INVALID -> new InvalidSettingException(this);
        };
    }
}
