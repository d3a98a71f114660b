package org.javai.deltashare.ops;

import org.javai.deltashare.Failure;

/**
 * Reports classified failures for observability.
 * Implementations might emit structured logs, metrics, or alerts.
 */
@FunctionalInterface
public interface OpReporter {

	/**
	 * Reports a failure occurrence.
	 */
	void report(Failure failure);

	/**
	 * A reporter that does nothing. Useful for testing.
	 */
	static OpReporter noOp() {
		return failure -> {};
	}
}
