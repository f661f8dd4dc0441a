package org.javai.notifier.config;

import org.javai.notifier.policy.SuppressionPolicy;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * Process-wide settings of the {@link SuppressionPolicy}.
 *
 * <p>Configuration is provided via system properties with environment variable fallbacks:
 * <ul>
 *   <li>{@code notifier.pending.debounce} / {@code NOTIFIER_PENDING_DEBOUNCE} - how long a pending
 *   notification record blocks further dispatches. An ISO-8601 duration ({@code PT90S}) or a
 *   number of seconds ({@code 90}). Defaults to one minute.</li>
 * </ul>
 *
 * @param pendingDebounce the pending-record debounce window
 */
public record PolicyConfig(Duration pendingDebounce) {

	public static final String PENDING_DEBOUNCE_PROPERTY = "notifier.pending.debounce";
	public static final String PENDING_DEBOUNCE_ENV = "NOTIFIER_PENDING_DEBOUNCE";

	public PolicyConfig {
		Objects.requireNonNull(pendingDebounce, "pendingDebounce must not be null");
		if (pendingDebounce.isNegative()) {
			throw new IllegalArgumentException("pendingDebounce must not be negative");
		}
	}

	public static PolicyConfig defaults() {
		return new PolicyConfig(SuppressionPolicy.DEFAULT_PENDING_DEBOUNCE);
	}

	/**
	 * Reads the configuration from system properties and the environment.
	 *
	 * @throws IllegalStateException if a value is set but cannot be parsed or is negative
	 */
	public static PolicyConfig fromEnvironment() {
		return from(ConfigResolver.system());
	}

	static PolicyConfig from(ConfigResolver resolver) {
		return resolver.resolveOptional(PENDING_DEBOUNCE_PROPERTY, PENDING_DEBOUNCE_ENV)
				.map(PolicyConfig::parseDuration)
				.map(PolicyConfig::new)
				.orElseGet(PolicyConfig::defaults);
	}

	public SuppressionPolicy toPolicy() {
		return pendingDebounce.equals(SuppressionPolicy.DEFAULT_PENDING_DEBOUNCE)
				? SuppressionPolicy.defaults()
				: new SuppressionPolicy(pendingDebounce);
	}

	private static Duration parseDuration(String value) {
		Duration parsed;
		try {
			parsed = value.regionMatches(true, 0, "P", 0, 1)
					? Duration.parse(value)
					: Duration.ofSeconds(Long.parseLong(value));
		} catch (DateTimeParseException | NumberFormatException e) {
			throw new IllegalStateException("Invalid " + PENDING_DEBOUNCE_PROPERTY + " value: " + value, e);
		}
		if (parsed.isNegative()) {
			throw new IllegalStateException(PENDING_DEBOUNCE_PROPERTY + " must not be negative: " + value);
		}
		return parsed;
	}
}
