package org.javai.deltashare.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ConfigResolverTest {

	private static ConfigResolver resolver(Map<String, String> sysProps, Map<String, String> env) {
		return new ConfigResolver(sysProps::get, env::get);
	}

	@Test
	void systemProperty_takesPrecedenceOverEnvironment() {
		ConfigResolver config = resolver(Map.of("app.key", "from-prop"), Map.of("APP_KEY", "from-env"));

		assertThat(config.required("app.key", "APP_KEY")).isEqualTo("from-prop");
	}

	@Test
	void blankSystemProperty_fallsBackToEnvironment() {
		ConfigResolver config = resolver(Map.of("app.key", "  "), Map.of("APP_KEY", " from-env "));

		assertThat(config.optional("app.key", "APP_KEY")).contains("from-env");
	}

	@Test
	void missingRequired_namesBothSources() {
		ConfigResolver config = resolver(Map.of(), Map.of());

		assertThatThrownBy(() -> config.required("app.key", "APP_KEY"))
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("app.key")
				.hasMessageContaining("APP_KEY");
	}

	@Test
	void duration_parsesIsoValue() {
		ConfigResolver config = resolver(Map.of(), Map.of("BUFFER", "PT2M"));

		assertThat(config.duration("app.buffer", "BUFFER", Duration.ofMinutes(5))).isEqualTo(Duration.ofMinutes(2));
		assertThat(config.duration("app.other", "OTHER", Duration.ofMinutes(5))).isEqualTo(Duration.ofMinutes(5));
	}

	@Test
	void duration_rejectsGarbageAndNonPositive() {
		assertThatThrownBy(() -> resolver(Map.of("app.buffer", "5 minutes"), Map.of())
				.duration("app.buffer", "BUFFER", Duration.ofMinutes(5)))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("app.buffer");
		assertThatThrownBy(() -> resolver(Map.of("app.buffer", "PT0S"), Map.of())
				.duration("app.buffer", "BUFFER", Duration.ofMinutes(5)))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void flag_acceptsOnlyTrueOrFalse() {
		assertThat(resolver(Map.of("f", "TRUE"), Map.of()).flag("f", "F", false)).isTrue();
		assertThat(resolver(Map.of(), Map.of()).flag("f", "F", false)).isFalse();
		assertThatThrownBy(() -> resolver(Map.of("f", "yes"), Map.of()).flag("f", "F", false))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
