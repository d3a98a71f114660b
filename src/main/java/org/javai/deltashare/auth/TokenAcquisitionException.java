package org.javai.deltashare.auth;

/**
 * Thrown when a bearer token cannot be obtained from the identity provider.
 * Nothing is cached when this is thrown.
 */
public class TokenAcquisitionException extends Exception {

    /**
     * Why the acquisition failed.
     */
    public enum Reason {
        /** The token endpoint could not be reached or the exchange broke off. */
        NETWORK,
        /** The token endpoint answered with a non-2xx status. */
        REJECTED,
        /** The response body could not be parsed or lacked required fields. */
        MALFORMED_RESPONSE,
        /** The issued token would already be inside the refresh buffer. */
        LIFETIME_TOO_SHORT,
        /** The waiting thread was interrupted. */
        INTERRUPTED
    }

    private final Reason reason;
    private final int statusCode;

    public TokenAcquisitionException(Reason reason, String message) {
        this(reason, message, -1, null);
    }

    public TokenAcquisitionException(Reason reason, String message, Throwable cause) {
        this(reason, message, -1, cause);
    }

    public TokenAcquisitionException(Reason reason, String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.statusCode = statusCode;
    }

    public Reason reason() {
        return reason;
    }

    /**
     * HTTP status of the token endpoint's answer, or -1 when there was none.
     */
    public int statusCode() {
        return statusCode;
    }
}
