package org.javai.notifier.settings;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class SettingsAccessorTest {

    private static Settings settings(Object... keyValues) {
        Map<String, Object> raw = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            raw.put((String) keyValues[i], keyValues[i + 1]);
        }
        return Settings.of(raw);
    }

    // === Missing keys ===

    @Test
    void getBool_missingKeyWithDefault_returnsDefaultWithoutError() {
        SettingResult<Boolean> result = SettingsAccessor.getBool(Settings.empty(), "uploadImage", true);

        assertThat(result.isValid()).isTrue();
        assertThat(result.value()).isTrue();
        assertThat(result.error()).isEmpty();
    }

    @Test
    void getString_missingKeyWithDefault_returnsDefaultWithoutError() {
        SettingResult<String> result = SettingsAccessor.getString(Settings.empty(), "url", "http://localhost");

        assertThat(result.isValid()).isTrue();
        assertThat(result.value()).isEqualTo("http://localhost");
    }

    @Test
    void getInt64_missingKeyWithDefault_returnsDefaultWithoutError() {
        SettingResult<Long> result = SettingsAccessor.getInt64(Settings.empty(), "retries", 7L);

        assertThat(result.isValid()).isTrue();
        assertThat(result.value()).isEqualTo(7L);
    }

    @Test
    void getBool_missingKeyWithoutDefault_isMissingSetting() {
        SettingResult<Boolean> result = SettingsAccessor.getBool(Settings.empty(), "autoResolve");

        assertThat(result.isValid()).isFalse();
        assertThat(result.value()).isFalse();
        assertThat(result.error()).hasValueSatisfying(error -> {
            assertThat(error.kind()).isEqualTo(SettingErrorKind.MISSING);
            assertThat(error.key()).isEqualTo("autoResolve");
            assertThat(error.message()).isEqualTo("Could not find autoResolve property in settings");
        });
    }

    @Test
    void getString_missingKeyWithoutDefault_throwsMissingSettingException() {
        SettingResult<String> result = SettingsAccessor.getString(Settings.empty(), "url");

        assertThat(result.value()).isEmpty();
        assertThatThrownBy(result::getOrThrow)
                .isInstanceOf(MissingSettingException.class)
                .hasMessage("Could not find url property in settings")
                .extracting(e -> ((SettingException) e).key())
                .isEqualTo("url");
    }

    @Test
    void getInt64_missingKeyWithoutDefault_returnsZeroWithError() {
        SettingResult<Long> result = SettingsAccessor.getInt64(Settings.empty(), "retries");

        assertThat(result.value()).isZero();
        assertThat(result.error()).map(SettingError::kind).hasValue(SettingErrorKind.MISSING);
    }

    // === Boolean coercion ===

    @Test
    void getBool_nativeBooleans_passThrough() {
        Settings settings = settings("on", true, "off", false);

        assertThat(SettingsAccessor.getBool(settings, "on").getOrThrow()).isTrue();
        assertThat(SettingsAccessor.getBool(settings, "off").getOrThrow()).isFalse();
    }

    @Test
    void getBool_nonEmptyString_isTrue() {
        assertThat(SettingsAccessor.getBool(settings("flag", "x"), "flag").getOrThrow()).isTrue();
    }

    @Test
    void getBool_stringFalse_isTrueBecauseItIsNonEmpty() {
        assertThat(SettingsAccessor.getBool(settings("flag", "false"), "flag").getOrThrow()).isTrue();
    }

    @Test
    void getBool_emptyString_isFalse() {
        SettingResult<Boolean> result = SettingsAccessor.getBool(settings("flag", ""), "flag", true);

        assertThat(result.isValid()).isTrue();
        assertThat(result.value()).isFalse();
    }

    @Test
    void getBool_integers_trueIffNonZero() {
        Settings settings = settings("zero", 0, "five", 5, "negative", -1L);

        assertThat(SettingsAccessor.getBool(settings, "zero").getOrThrow()).isFalse();
        assertThat(SettingsAccessor.getBool(settings, "five").getOrThrow()).isTrue();
        assertThat(SettingsAccessor.getBool(settings, "negative").getOrThrow()).isTrue();
    }

    @Test
    void getBool_decimalBelowOne_truncatesToFalse() {
        assertThat(SettingsAccessor.getBool(settings("flag", 0.5), "flag").getOrThrow()).isFalse();
    }

    @Test
    void getBool_objectValue_isInvalidAndKeepsDefault() {
        SettingResult<Boolean> result = SettingsAccessor.getBool(settings("flag", Map.of("a", 1)), "flag", true);

        assertThat(result.isValid()).isFalse();
        assertThat(result.value()).isTrue();
        assertThat(result.error()).hasValueSatisfying(error -> {
            assertThat(error.kind()).isEqualTo(SettingErrorKind.INVALID);
            assertThat(error.message()).isEqualTo("Invalid flag property in settings");
        });
    }

    @Test
    void getBool_nullValue_isInvalid() {
        SettingResult<Boolean> result = SettingsAccessor.getBool(settings("flag", null), "flag");

        assertThat(result.value()).isFalse();
        assertThatThrownBy(result::getOrThrow).isInstanceOf(InvalidSettingException.class);
    }

    // === String coercion ===

    @Test
    void getString_nativeString_isReturned() {
        assertThat(SettingsAccessor.getString(settings("url", "http://example.com"), "url").getOrThrow())
                .isEqualTo("http://example.com");
    }

    @Test
    void getString_number_isInvalidAndReturnsDefault() {
        SettingResult<String> result = SettingsAccessor.getString(settings("url", 42), "url", "fallback");

        assertThat(result.isValid()).isFalse();
        assertThat(result.value()).isEqualTo("fallback");
        assertThat(result.getOrElse("other")).isEqualTo("other");
    }

    @Test
    void getString_boolean_isInvalidWithoutDefault_returnsEmptyString() {
        SettingResult<String> result = SettingsAccessor.getString(settings("url", true), "url");

        assertThat(result.value()).isEmpty();
        assertThat(result.error()).map(SettingError::kind).hasValue(SettingErrorKind.INVALID);
    }

    // === Integer coercion ===

    @Test
    void getInt64_nativeInteger_isReturned() {
        assertThat(SettingsAccessor.getInt64(settings("retries", 3), "retries").getOrThrow()).isEqualTo(3L);
    }

    @Test
    void getInt64_numericString_isParsed() {
        assertThat(SettingsAccessor.getInt64(settings("retries", "42"), "retries").getOrThrow()).isEqualTo(42L);
        assertThat(SettingsAccessor.getInt64(settings("offset", "-17"), "offset").getOrThrow()).isEqualTo(-17L);
    }

    @Test
    void getInt64_nonNumericString_isInvalidAndReturnsDefault() {
        SettingResult<Long> result = SettingsAccessor.getInt64(settings("retries", "abc"), "retries", 5L);

        assertThat(result.isValid()).isFalse();
        assertThat(result.value()).isEqualTo(5L);
        assertThatThrownBy(result::getOrThrow)
                .isInstanceOf(InvalidSettingException.class)
                .hasMessage("Invalid retries property in settings");
    }

    @Test
    void getInt64_decimalString_isInvalid() {
        assertThat(SettingsAccessor.getInt64(settings("retries", "1.5"), "retries").isValid()).isFalse();
    }

    @Test
    void getInt64_decimal_truncatesTowardZero() {
        Settings settings = settings("up", 2.9, "down", -2.9);

        assertThat(SettingsAccessor.getInt64(settings, "up").getOrThrow()).isEqualTo(2L);
        assertThat(SettingsAccessor.getInt64(settings, "down").getOrThrow()).isEqualTo(-2L);
    }

    @Test
    void getInt64_boolean_isInvalid() {
        assertThat(SettingsAccessor.getInt64(settings("retries", true), "retries").isValid()).isFalse();
    }

    @Test
    void getInt64_list_isInvalid() {
        assertThat(SettingsAccessor.getInt64(settings("retries", List.of(1, 2)), "retries").isValid()).isFalse();
    }

    @Test
    void reads_arePure() {
        Settings settings = settings("flag", "yes");

        SettingResult<Boolean> first = SettingsAccessor.getBool(settings, "flag");
        SettingResult<Boolean> second = SettingsAccessor.getBool(settings, "flag");

        assertThat(first).isEqualTo(second);
        assertThat(settings.find("flag")).hasValue(new SettingValue.TextValue("yes"));
    }
}
