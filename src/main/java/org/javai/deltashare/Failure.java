package org.javai.deltashare;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A classified failure together with the context of the operation that failed.
 *
 * @param outcome The classification of the failure
 * @param operation The operation that failed (e.g., "shares.create", "recipients.get")
 * @param occurredAt When the failure happened
 * @param correlationId Request correlation identifier (may be null)
 * @param tags Additional key-value metadata for observability
 */
public record Failure(
        ClassifiedOutcome outcome,
        String operation,
        Instant occurredAt,
        String correlationId,
        Map<String, String> tags
) {

    public Failure {
        Objects.requireNonNull(outcome, "outcome must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(occurredAt, "occurredAt must not be null");
        tags = tags == null ? Map.of() : Map.copyOf(tags);
    }

    public static Failure of(ClassifiedOutcome outcome, String operation) {
        return new Failure(outcome, operation, Instant.now(), null, null);
    }

    public OutcomeKind kind() {
        return outcome.kind();
    }

    public OutcomeCategory category() {
        return outcome.kind().category();
    }

    public String message() {
        return outcome.message();
    }

    public Cause cause() {
        return outcome.cause();
    }

    public Throwable signal() {
        return outcome.signal();
    }
}
