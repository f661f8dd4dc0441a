package org.javai.notifier.settings;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Typed, lenient reads from a channel's {@link Settings}.
 *
 * <p>Every type has a strict overload, where an absent key is a
 * {@link SettingErrorKind#MISSING} error, and an optional overload taking a default that is
 * returned for an absent key. A present key is coerced in a fixed priority order:
 *
 * <table>
 *   <caption>Accepted representations, tried left to right</caption>
 *   <tr><th>Requested</th><th>1st</th><th>2nd</th><th>3rd</th></tr>
 *   <tr><td>boolean</td><td>boolean</td><td>string, true iff non-empty</td><td>number, true iff non-zero</td></tr>
 *   <tr><td>string</td><td>string</td><td></td><td></td></tr>
 *   <tr><td>long</td><td>number</td><td>string parsed as base-10 long</td><td></td></tr>
 * </table>
 *
 * <p>When no representation matches, the read is {@link SettingErrorKind#INVALID} and the
 * result still carries the default (or the type's zero value when no default was given).
 */
public final class SettingsAccessor {

    private SettingsAccessor() {
        // Utility class
    }

    public static SettingResult<Boolean> getBool(Settings settings, String key) {
        return read(settings, key, Optional.empty(), false, SettingsAccessor::coerceBool);
    }

    public static SettingResult<Boolean> getBool(Settings settings, String key, boolean defaultValue) {
        return read(settings, key, Optional.of(defaultValue), false, SettingsAccessor::coerceBool);
    }

    public static SettingResult<String> getString(Settings settings, String key) {
        return read(settings, key, Optional.empty(), "", SettingValue::asText);
    }

    public static SettingResult<String> getString(Settings settings, String key, String defaultValue) {
        Objects.requireNonNull(defaultValue, "defaultValue must not be null");
        return read(settings, key, Optional.of(defaultValue), "", SettingValue::asText);
    }

    public static SettingResult<Long> getInt64(Settings settings, String key) {
        return read(settings, key, Optional.empty(), 0L, SettingsAccessor::coerceLong);
    }

    public static SettingResult<Long> getInt64(Settings settings, String key, long defaultValue) {
        return read(settings, key, Optional.of(defaultValue), 0L, SettingsAccessor::coerceLong);
    }

    private static <T> SettingResult<T> read(
            Settings settings,
            String key,
            Optional<T> defaultValue,
            T zeroValue,
            Function<SettingValue, Optional<T>> coercion) {
        Objects.requireNonNull(settings, "settings must not be null");
        Objects.requireNonNull(key, "key must not be null");

        T fallback = defaultValue.orElse(zeroValue);
        Optional<SettingValue> found = settings.find(key);
        if (found.isEmpty()) {
            return defaultValue.isPresent()
                    ? SettingResult.resolved(fallback)
                    : SettingResult.rejected(SettingError.missing(key), fallback);
        }

        return coercion.apply(found.get())
                .<SettingResult<T>>map(SettingResult::resolved)
                .orElseGet(() -> SettingResult.rejected(SettingError.invalid(key), fallback));
    }

    static Optional<Boolean> coerceBool(SettingValue value) {
        Optional<Boolean> bool = value.asBoolean();
        if (bool.isPresent()) {
            return bool;
        }
        Optional<String> text = value.asText();
        if (text.isPresent()) {
            return Optional.of(!text.get().isEmpty());
        }
        return value.asLong().map(number -> number != 0L);
    }

    static Optional<Long> coerceLong(SettingValue value) {
        Optional<Long> number = value.asLong();
        if (number.isPresent()) {
            return number;
        }
        return value.asText().flatMap(SettingsAccessor::parseLong);
    }

    private static Optional<Long> parseLong(String text) {
        try {
            return Optional.of(Long.parseLong(text, 10));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
