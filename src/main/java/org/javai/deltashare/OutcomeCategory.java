package org.javai.deltashare;

/**
 * Groups outcome kinds by what they tell the client about the request.
 */
public enum OutcomeCategory {
    /**
     * A legitimate negative answer from the sharing platform (resource missing,
     * already exists, invalid input, not allowed). Retrying the same request
     * will give the same answer.
     */
    BUSINESS,

    /**
     * The service could not obtain a credential from the identity provider.
     * Says nothing about the requested resource.
     */
    CREDENTIAL,

    /**
     * The caller-supplied workspace address was rejected or could not be reached.
     */
    ENDPOINT,

    /**
     * The sharing platform failed in a way that is not a business answer.
     */
    INFRASTRUCTURE
}
