package org.javai.notifier.settings;

/**
 * Why a setting could not be read.
 */
public enum SettingErrorKind {
    /**
     * The key is absent and the caller supplied no default.
     */
    MISSING,

    /**
     * The key is present but none of the representations accepted for the requested type matched.
     */
    INVALID
}
