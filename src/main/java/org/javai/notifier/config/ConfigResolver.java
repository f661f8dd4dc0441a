package org.javai.notifier.config;

import java.util.Optional;
import java.util.function.Function;

/**
 * Resolves configuration from system properties with environment variable fallbacks.
 */
public final class ConfigResolver {

	private final Function<String, String> systemProperties;
	private final Function<String, String> environment;

	private static final ConfigResolver SYSTEM = new ConfigResolver(System::getProperty, System::getenv);

	/**
	 * Creates a resolver over explicit lookups.
	 * Package-private for testing.
	 */
	ConfigResolver(Function<String, String> systemProperties, Function<String, String> environment) {
		this.systemProperties = systemProperties;
		this.environment = environment;
	}

	/**
	 * The resolver backed by {@link System#getProperty} and {@link System#getenv}.
	 */
	public static ConfigResolver system() {
		return SYSTEM;
	}

	/**
	 * Resolves a value, preferring the system property.
	 *
	 * @param sysProp the system property name
	 * @param envVar the environment variable name
	 * @return the value, or empty if neither is set to a non-blank value
	 */
	public Optional<String> resolveOptional(String sysProp, String envVar) {
		String value = systemProperties.apply(sysProp);
		if (value == null || value.isBlank()) {
			value = environment.apply(envVar);
		}
		if (value == null || value.isBlank()) {
			return Optional.empty();
		}
		return Optional.of(value.trim());
	}

	/**
	 * Resolves a required value.
	 *
	 * @throws IllegalStateException if neither is set
	 */
	public String resolveRequired(String sysProp, String envVar) {
		return resolveOptional(sysProp, envVar).orElseThrow(() -> new IllegalStateException(
				"Missing required configuration: set system property '" + sysProp +
				"' or environment variable '" + envVar + "'"
		));
	}
}
