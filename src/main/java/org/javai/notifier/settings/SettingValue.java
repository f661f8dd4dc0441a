package org.javai.notifier.settings;

import java.util.Objects;
import java.util.Optional;

/**
 * A single untyped value held in a channel's {@link Settings}.
 *
 * <p>Settings blobs are loosely typed: the same flag may be stored as a JSON boolean
 * or as a string or number, depending on which client saved it. Each variant exposes the
 * three representations it can be read as; {@link SettingsAccessor} decides the order
 * in which those representations are tried for a requested type.
 *
 * <ul>
 *   <li>{@link #asBoolean()} succeeds only for a native boolean</li>
 *   <li>{@link #asText()} succeeds only for a native string</li>
 *   <li>{@link #asLong()} succeeds for integral numbers and for decimals truncated toward zero</li>
 * </ul>
 */
public sealed interface SettingValue permits SettingValue.BoolValue, SettingValue.TextValue,
        SettingValue.IntegerValue, SettingValue.DecimalValue, SettingValue.NullValue, SettingValue.StructuredValue {

    /**
     * A native boolean.
     */
    record BoolValue(boolean value) implements SettingValue {

        @Override
        public Optional<Boolean> asBoolean() {
            return Optional.of(value);
        }
    }

    /**
     * A native string.
     */
    record TextValue(String value) implements SettingValue {

        public TextValue {
            Objects.requireNonNull(value, "value must not be null, use NullValue");
        }

        @Override
        public Optional<String> asText() {
            return Optional.of(value);
        }
    }

    /**
     * An integral number that fits in a signed 64-bit long.
     */
    record IntegerValue(long value) implements SettingValue {

        @Override
        public Optional<Long> asLong() {
            return Optional.of(value);
        }
    }

    /**
     * A number with a fractional part, or an integer too large for a long.
     */
    record DecimalValue(double value) implements SettingValue {

        @Override
        public Optional<Long> asLong() {
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                return Optional.empty();
            }
            // (double) Long.MAX_VALUE rounds up to 2^63, so the upper bound is exclusive
            if (value < (double) Long.MIN_VALUE || value >= (double) Long.MAX_VALUE) {
                return Optional.empty();
            }
            return Optional.of((long) value);
        }
    }

    /**
     * An explicit null. Present as a key, but readable as nothing.
     */
    record NullValue() implements SettingValue {

        private static final NullValue INSTANCE = new NullValue();

        public static NullValue instance() {
            return INSTANCE;
        }
    }

    /**
     * An array or nested object. Kept as its raw form for diagnostics only.
     *
     * @param raw the original value, as parsed
     */
    record StructuredValue(Object raw) implements SettingValue {
    }

    default Optional<Boolean> asBoolean() {
        return Optional.empty();
    }

    default Optional<String> asText() {
        return Optional.empty();
    }

    default Optional<Long> asLong() {
        return Optional.empty();
    }

    static SettingValue of(boolean value) {
        return new BoolValue(value);
    }

    static SettingValue of(String value) {
        return value == null ? NullValue.instance() : new TextValue(value);
    }

    static SettingValue of(long value) {
        return new IntegerValue(value);
    }

    static SettingValue of(double value) {
        return new DecimalValue(value);
    }
}
