package org.javai.deltashare.auth;

import java.time.Instant;

/**
 * Performs one token acquisition against the identity provider.
 * Implementations do not cache; {@link TokenCache} does.
 */
@FunctionalInterface
public interface TokenSource {

    /**
     * Acquires a new credential.
     *
     * @param now the instant the acquisition starts; the credential's expiry is computed from it
     * @return the newly issued credential
     * @throws TokenAcquisitionException if the exchange fails for any reason
     */
    Credential acquire(Instant now) throws TokenAcquisitionException;
}
