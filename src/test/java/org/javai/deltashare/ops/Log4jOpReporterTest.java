package org.javai.deltashare.ops;

import org.apache.logging.log4j.Level;
import org.javai.deltashare.ClassifiedOutcome;
import org.javai.deltashare.Failure;
import org.javai.deltashare.OutcomeCategory;
import org.javai.deltashare.OutcomeKind;
import org.javai.deltashare.auth.TokenAcquisitionException;
import org.javai.deltashare.boundary.SharingApiException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class Log4jOpReporterTest {

	@Test
	void levelFollowsCategory() {
		assertThat(Log4jOpReporter.levelFor(OutcomeCategory.INFRASTRUCTURE)).isEqualTo(Level.ERROR);
		assertThat(Log4jOpReporter.levelFor(OutcomeCategory.CREDENTIAL)).isEqualTo(Level.ERROR);
		assertThat(Log4jOpReporter.levelFor(OutcomeCategory.ENDPOINT)).isEqualTo(Level.WARN);
		assertThat(Log4jOpReporter.levelFor(OutcomeCategory.BUSINESS)).isEqualTo(Level.INFO);
	}

	@Test
	void format_includesContext() {
		ClassifiedOutcome classified = ClassifiedOutcome.of(OutcomeKind.NOT_FOUND,
				"Databricks error RESOURCE_DOES_NOT_EXIST: Share does not exist",
				new SharingApiException(404, "RESOURCE_DOES_NOT_EXIST", "Share does not exist"));
		Failure failure = new Failure(classified, "shares.get", Instant.parse("2026-01-01T00:00:00Z"),
				"req-7", Map.of("workspace", "https://a.cloud.databricks.com", "share", "sales"));

		String line = Log4jOpReporter.format(failure);

		assertThat(line)
				.startsWith("Failure in operation [shares.get]: Databricks error RESOURCE_DOES_NOT_EXIST")
				.contains("kind=NOT_FOUND", "category=BUSINESS", "status=404", "correlationId=req-7")
				.contains("tags={share=sales, workspace=https://a.cloud.databricks.com}")
				.endsWith("cause=org.javai.deltashare.boundary.SharingApiException[RESOURCE_DOES_NOT_EXIST]");
	}

	@Test
	void format_keepsCallerSuppliedTextOnOneLine() {
		ClassifiedOutcome classified = ClassifiedOutcome.of(OutcomeKind.INVALID_ENDPOINT,
				"Invalid workspace URL: must use https",
				new IOException("x"));
		Failure failure = new Failure(classified, "shares.get", Instant.parse("2026-01-01T00:00:00Z"),
				null, Map.of("workspace", "http://a\r\nFailure in operation [forged]"));

		String line = Log4jOpReporter.format(failure);

		assertThat(line)
				.doesNotContain("\n", "\r")
				.contains("workspace=http://a\\r\\nFailure in operation [forged]");
	}

	@Test
	void format_tokenFailure_showsReason() {
		ClassifiedOutcome classified = ClassifiedOutcome.of(OutcomeKind.AUTH_ACQUISITION_FAILED,
				"Token acquisition failed (NETWORK): reset",
				new TokenAcquisitionException(TokenAcquisitionException.Reason.NETWORK, "reset"));

		assertThat(Log4jOpReporter.format(Failure.of(classified, "shares.list")))
				.endsWith("cause=org.javai.deltashare.auth.TokenAcquisitionException[NETWORK]");
	}

	@Test
	void report_doesNotThrow() {
		Failure failure = Failure.of(ClassifiedOutcome.of(OutcomeKind.UPSTREAM_UNAVAILABLE,
				"Databricks service error: reset", new IOException("reset")), "shares.list");

		assertThatCode(() -> new Log4jOpReporter().report(failure)).doesNotThrowAnyException();
	}
}
