package org.javai.deltashare.endpoint;

/**
 * Base type for rejections raised by {@link EndpointValidator}.
 */
public abstract class EndpointException extends Exception {

    private final String address;

    protected EndpointException(String address, String message, Throwable cause) {
        super(message, cause);
        this.address = address;
    }

    /**
     * The address the caller supplied.
     */
    public String address() {
        return address;
    }
}
