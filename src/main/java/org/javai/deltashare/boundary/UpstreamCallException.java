package org.javai.deltashare.boundary;

/**
 * An unchecked exception raised by the platform call itself, carried as a checked
 * signal so the {@link Boundary} classifies it instead of treating it as a defect.
 *
 * <p>Vendor clients report transport and protocol failures with unchecked exceptions
 * ({@code UncheckedIOException}, SDK-specific runtime errors). Those are operational
 * failures of the upstream, not bugs in this code.
 */
public class UpstreamCallException extends Exception {

    private final String operation;

    public UpstreamCallException(String operation, RuntimeException cause) {
        super("Unexpected failure in " + operation + ": " + cause, cause);
        this.operation = operation;
    }

    public String operation() {
        return operation;
    }
}
