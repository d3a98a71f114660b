package org.javai.deltashare.boundary;

import org.javai.deltashare.ClassifiedOutcome;
import org.javai.deltashare.Failure;
import org.javai.deltashare.Outcome;
import org.javai.deltashare.ops.OpReporter;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * The point where calls that throw checked exceptions become {@link Outcome}s.
 * Catches the exception, classifies it, reports it, and returns {@link Outcome.Fail}.
 *
 * <p>RuntimeExceptions are defects, not operational failures: they propagate unchanged.
 *
 * <pre>{@code
 * Boundary boundary = Boundary.withReporter(new Log4jOpReporter());
 *
 * Outcome<ShareInfo> share = boundary.call("shares.get", () -> sharesApi.get(name));
 * }</pre>
 */
public final class Boundary {

    private static final FailureClassifier DEFAULT_CLASSIFIER = new SharingFailureClassifier();

    private final FailureClassifier classifier;
    private final OpReporter reporter;
    private final Supplier<String> correlationIdSupplier;

    /**
     * Creates a Boundary that classifies failures but does not report them.
     */
    public static Boundary silent() {
        return new Boundary(DEFAULT_CLASSIFIER, OpReporter.noOp());
    }

    /**
     * Creates a Boundary with the sharing classifier and the given reporter.
     */
    public static Boundary withReporter(OpReporter reporter) {
        return new Boundary(DEFAULT_CLASSIFIER, reporter);
    }

    public static Boundary of(FailureClassifier classifier, OpReporter reporter) {
        return new Boundary(classifier, reporter);
    }

    public Boundary(FailureClassifier classifier, OpReporter reporter) {
        this(classifier, reporter, () -> null);
    }

    /**
     * @param correlationIdSupplier supplies the current request's correlation id (may return null)
     */
    public Boundary(FailureClassifier classifier, OpReporter reporter, Supplier<String> correlationIdSupplier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
        this.correlationIdSupplier = Objects.requireNonNull(correlationIdSupplier, "correlationIdSupplier must not be null");
    }

    /**
     * Executes work that may throw checked exceptions, translating any such exception into an Outcome.
     *
     * @param operation The operation name for context and reporting
     * @param work The work to execute
     * @return Ok with the result, or Fail with a classified failure
     */
    public <T> Outcome<T> call(String operation, ThrowingSupplier<T, ? extends Exception> work) {
        return call(operation, Map.of(), work);
    }

    /**
     * Executes work with additional tags for observability.
     */
    public <T> Outcome<T> call(String operation, Map<String, String> tags, ThrowingSupplier<T, ? extends Exception> work) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");

        try {
            return Outcome.ok(work.get());
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            return handleException(operation, tags, e);
        }
    }

    private <T> Outcome<T> handleException(String operation, Map<String, String> tags, Exception e) {
        Instant occurredAt = Instant.now();
        ClassifiedOutcome classified = classifier.classify(operation, e);
        Failure failure = new Failure(classified, operation, occurredAt, correlationIdSupplier.get(), tags);

        reporter.report(failure);
        return Outcome.fail(failure);
    }
}
