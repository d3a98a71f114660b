package org.javai.deltashare.ops;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.deltashare.Cause;
import org.javai.deltashare.Failure;
import org.javai.deltashare.OutcomeCategory;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reports failures using Log4j2.
 *
 * <p>The level follows the failure's {@link OutcomeCategory}:
 * <ul>
 *   <li>{@code CREDENTIAL}, {@code INFRASTRUCTURE} → ERROR</li>
 *   <li>{@code ENDPOINT} → WARN</li>
 *   <li>{@code BUSINESS} → INFO</li>
 * </ul>
 * The underlying signal's stack trace is attached only for ERROR entries.
 */
public class Log4jOpReporter implements OpReporter {

	private static final Marker FAILURE_MARKER = MarkerManager.getMarker("FAILURE");

	private final Logger logger;

	/**
	 * Creates a Log4jOpReporter using the default logger name.
	 */
	public Log4jOpReporter() {
		this(LogManager.getLogger("org.javai.deltashare.OpReporter"));
	}

	public Log4jOpReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	public Log4jOpReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void report(Failure failure) {
		Level level = levelFor(failure.category());
		if (level == Level.ERROR) {
			logger.atLevel(level)
				.withMarker(FAILURE_MARKER)
				.withThrowable(failure.signal())
				.log(format(failure));
		} else {
			logger.atLevel(level)
				.withMarker(FAILURE_MARKER)
				.log(format(failure));
		}
	}

	static String format(Failure failure) {
		return "Failure in operation [%s]: %s | kind=%s, category=%s, status=%d%s%s%s".formatted(
				OpReporterUtils.printable(failure.operation()),
				OpReporterUtils.printable(failure.message()),
				failure.kind(),
				failure.category(),
				failure.kind().httpStatus(),
				formatCorrelationId(failure.correlationId()),
				formatTags(failure.tags()),
				formatCause(failure.cause()));
	}

	private static String formatCorrelationId(String correlationId) {
		return correlationId != null ? ", correlationId=" + OpReporterUtils.printable(correlationId) : "";
	}

	private static String formatTags(Map<String, String> tags) {
		if (tags == null || tags.isEmpty()) {
			return "";
		}
		return ", tags={" + tags.entrySet().stream()
				.sorted(Map.Entry.comparingByKey())
				.map(e -> e.getKey() + "=" + OpReporterUtils.printable(e.getValue()))
				.collect(Collectors.joining(", ")) + "}";
	}

	private static String formatCause(Cause cause) {
		if (cause == null) {
			return "";
		}
		return ", cause=" + cause.type() + (cause.code() != null ? "[" + cause.code() + "]" : "");
	}

	static Level levelFor(OutcomeCategory category) {
		return switch (category) {
			case CREDENTIAL, INFRASTRUCTURE -> Level.ERROR;
			case ENDPOINT -> Level.WARN;
			case BUSINESS -> Level.INFO;
		};
	}
}
