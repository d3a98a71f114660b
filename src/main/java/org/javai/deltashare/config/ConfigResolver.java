package org.javai.deltashare.config;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Resolves configuration values from system properties, falling back to environment variables.
 */
public final class ConfigResolver {

	private final UnaryOperator<String> systemProperties;
	private final UnaryOperator<String> environment;

	/**
	 * Resolver backed by {@link System#getProperty(String)} and {@link System#getenv(String)}.
	 */
	public static ConfigResolver system() {
		return new ConfigResolver(System::getProperty, System::getenv);
	}

	/**
	 * Useful for testing.
	 */
	public ConfigResolver(UnaryOperator<String> systemProperties, UnaryOperator<String> environment) {
		this.systemProperties = Objects.requireNonNull(systemProperties, "systemProperties must not be null");
		this.environment = Objects.requireNonNull(environment, "environment must not be null");
	}

	/**
	 * @throws IllegalStateException if neither source has a non-blank value
	 */
	public String required(String sysProp, String envVar) {
		return optional(sysProp, envVar).orElseThrow(() -> new IllegalStateException(
				"Missing required configuration: set system property '" + sysProp +
				"' or environment variable '" + envVar + "'"));
	}

	public Optional<String> optional(String sysProp, String envVar) {
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
	 * Reads an ISO-8601 duration such as {@code PT5M}.
	 *
	 * @throws IllegalArgumentException if the value is not a positive duration
	 */
	public Duration duration(String sysProp, String envVar, Duration defaultValue) {
		Optional<String> raw = optional(sysProp, envVar);
		if (raw.isEmpty()) {
			return defaultValue;
		}
		try {
			Duration parsed = Duration.parse(raw.get());
			if (parsed.isNegative() || parsed.isZero()) {
				throw new IllegalArgumentException(sysProp + " must be a positive duration, got " + raw.get());
			}
			return parsed;
		} catch (DateTimeParseException e) {
			throw new IllegalArgumentException(sysProp + " is not an ISO-8601 duration: " + raw.get(), e);
		}
	}

	public boolean flag(String sysProp, String envVar, boolean defaultValue) {
		Optional<String> raw = optional(sysProp, envVar);
		if (raw.isEmpty()) {
			return defaultValue;
		}
		String value = raw.get();
		if (value.equalsIgnoreCase("true")) {
			return true;
		}
		if (value.equalsIgnoreCase("false")) {
			return false;
		}
		throw new IllegalArgumentException(sysProp + " must be true or false, got " + value);
	}
}
