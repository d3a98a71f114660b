package org.javai.deltashare;

import java.util.Objects;

/**
 * A failure signal collapsed into the closed {@link OutcomeKind} taxonomy.
 * This is what classifiers produce; the Boundary adds operational context to
 * create a full {@link Failure}.
 *
 * @param kind The outcome kind
 * @param message Human-readable description for operators (may contain upstream detail)
 * @param signal The throwable that caused the failure, kept for diagnostics only
 * @param cause Diagnostic summary of the signal
 */
public record ClassifiedOutcome(
        OutcomeKind kind,
        String message,
        Throwable signal,
        Cause cause
) {

    public ClassifiedOutcome {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(signal, "signal must not be null");
        Objects.requireNonNull(cause, "cause must not be null");
    }

    public static ClassifiedOutcome of(OutcomeKind kind, String message, Throwable signal) {
        return new ClassifiedOutcome(kind, message, signal, Cause.fromThrowable(signal));
    }

    public OutcomeCategory category() {
        return kind.category();
    }
}
