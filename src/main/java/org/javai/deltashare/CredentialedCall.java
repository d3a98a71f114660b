package org.javai.deltashare;

import org.javai.deltashare.auth.Credential;
import org.javai.deltashare.endpoint.Destination;

/**
 * A call to the sharing platform that needs a validated workspace and a live credential.
 *
 * @param <T> The type of the call's result
 */
@FunctionalInterface
public interface CredentialedCall<T> {

    T invoke(Destination destination, Credential credential) throws Exception;
}
