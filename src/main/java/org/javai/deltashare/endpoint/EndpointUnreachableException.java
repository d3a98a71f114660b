package org.javai.deltashare.endpoint;

import java.util.Objects;

/**
 * The supplied address is well formed but the workspace did not resolve or respond.
 * Signals an infrastructure condition, not a bad request.
 */
public class EndpointUnreachableException extends EndpointException {

    private final UnreachableReason reason;

    public EndpointUnreachableException(String address, UnreachableReason reason, String message, Throwable cause) {
        super(address, message, cause);
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
    }

    public UnreachableReason reason() {
        return reason;
    }
}
