package org.javai.deltashare;

import org.javai.deltashare.auth.TokenAcquisitionException;
import org.javai.deltashare.boundary.SharingApiException;
import org.javai.deltashare.boundary.UpstreamCallException;
import org.javai.deltashare.endpoint.EndpointUnreachableException;

import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Diagnostic summary of the signal behind a failure, for operators.
 *
 * <p>Transport wrappers are unwrapped, so the summary describes the exception that
 * actually went wrong rather than the envelope it travelled in.
 *
 * @param type Class name of the root signal
 * @param fingerprint Root type and throw site, stable across occurrences for deduplication
 * @param detail Message of the root signal, may be null
 * @param code Upstream diagnostic code (platform {@code error_code}, token or
 *             reachability reason), may be null
 */
public record Cause(String type, String fingerprint, String detail, String code) {

    public Cause {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(fingerprint, "fingerprint must not be null");
    }

    public static Cause fromThrowable(Throwable signal) {
        Objects.requireNonNull(signal, "signal must not be null");
        Throwable root = unwrap(signal);
        return new Cause(root.getClass().getName(), fingerprintOf(root), root.getMessage(), codeOf(root));
    }

    static Throwable unwrap(Throwable signal) {
        Throwable current = signal;
        // bounded so a self-referencing cause chain cannot loop
        for (int depth = 0; depth < 8 && isWrapper(current) && current.getCause() != null; depth++) {
            current = current.getCause();
        }
        return current;
    }

    private static boolean isWrapper(Throwable t) {
        return t instanceof UpstreamCallException
                || t instanceof UncheckedIOException
                || t instanceof CompletionException
                || t instanceof ExecutionException;
    }

    private static String codeOf(Throwable root) {
        if (root instanceof SharingApiException api) {
            return api.errorCode() != null ? api.errorCode() : "HTTP_" + api.statusCode();
        }
        if (root instanceof TokenAcquisitionException tae) {
            return tae.reason().name();
        }
        if (root instanceof EndpointUnreachableException eue) {
            return eue.reason().name();
        }
        return null;
    }

    private static String fingerprintOf(Throwable t) {
        StackTraceElement[] stack = t.getStackTrace();
        if (stack.length == 0) {
            return t.getClass().getName();
        }
        StackTraceElement top = stack[0];
        return t.getClass().getSimpleName() + "@" + top.getClassName() + ":" + top.getLineNumber();
    }
}
