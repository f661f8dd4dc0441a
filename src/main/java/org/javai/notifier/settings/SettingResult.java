package org.javai.notifier.settings;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * The result of reading a typed setting.
 * Either {@link Resolved} holding the value read (or the default for an absent key), or
 * {@link Rejected} holding a {@link SettingError} together with a fallback value.
 *
 * <p>A rejected read still carries a usable value: the default the caller supplied, or the
 * type's zero value when there was none. Lenient callers can use {@link #value()} and ignore
 * the error; strict callers use {@link #getOrThrow()}.
 *
 * @param <T> The type of the setting
 */
public sealed interface SettingResult<T> permits SettingResult.Resolved, SettingResult.Rejected {

    /**
     * A successful read.
     *
     * @param value the coerced value, or the caller's default when the key was absent
     */
    record Resolved<T>(T value) implements SettingResult<T> {

        public Resolved {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public boolean isValid() {
            return true;
        }

        @Override
        public Optional<SettingError> error() {
            return Optional.empty();
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public T getOrElse(T defaultValue) {
            return value;
        }

        @Override
        public <U> SettingResult<U> map(Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return new Resolved<>(mapper.apply(value));
        }
    }

    /**
     * A failed read.
     *
     * @param failure what went wrong
     * @param value the fallback returned alongside the failure
     */
    record Rejected<T>(SettingError failure, T value) implements SettingResult<T> {

        public Rejected {
            Objects.requireNonNull(failure, "failure must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public boolean isValid() {
            return false;
        }

        @Override
        public Optional<SettingError> error() {
            return Optional.of(failure);
        }

        @Override
        public T getOrThrow() {
            throw failure.toException();
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }

        @Override
        public <U> SettingResult<U> map(Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return new Rejected<>(failure, mapper.apply(value));
        }
    }

    boolean isValid();

    /**
     * The value to use: the resolved value, or the fallback of a rejected read.
     */
    T value();

    Optional<SettingError> error();

    T getOrThrow();

    T getOrElse(T defaultValue);

    <U> SettingResult<U> map(Function<? super T, ? extends U> mapper);

    static <T> SettingResult<T> resolved(T value) {
        return new Resolved<>(value);
    }

    static <T> SettingResult<T> rejected(SettingError error, T fallback) {
        return new Rejected<>(error, fallback);
    }
}
