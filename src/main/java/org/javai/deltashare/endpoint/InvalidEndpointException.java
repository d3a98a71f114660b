package org.javai.deltashare.endpoint;

/**
 * The supplied address is malformed, not https, or outside the accepted workspace domains.
 */
public class InvalidEndpointException extends EndpointException {

    public InvalidEndpointException(String address, String message) {
        super(address, message, null);
    }

    public InvalidEndpointException(String address, String message, Throwable cause) {
        super(address, message, cause);
    }
}
