package org.javai.deltashare.auth;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * An issued bearer token and its validity window. Immutable: a refresh produces
 * a new Credential.
 *
 * @param bearerValue The opaque access token
 * @param issuedAt When the token was acquired
 * @param expiresAt When the identity provider stops accepting the token
 * @param accountId The account the token is scoped to
 */
public record Credential(
        String bearerValue,
        Instant issuedAt,
        Instant expiresAt,
        String accountId
) {

    public Credential {
        Objects.requireNonNull(bearerValue, "bearerValue must not be null");
        Objects.requireNonNull(issuedAt, "issuedAt must not be null");
        Objects.requireNonNull(expiresAt, "expiresAt must not be null");
        Objects.requireNonNull(accountId, "accountId must not be null");
        if (bearerValue.isBlank()) {
            throw new IllegalArgumentException("bearerValue must not be blank");
        }
        if (!expiresAt.isAfter(issuedAt)) {
            throw new IllegalArgumentException("expiresAt must be after issuedAt");
        }
    }

    public Duration remainingAt(Instant now) {
        return Duration.between(now, expiresAt);
    }

    /**
     * True when more than {@code refreshBuffer} of validity remains at {@code now}.
     */
    public boolean isUsableAt(Instant now, Duration refreshBuffer) {
        return remainingAt(now).compareTo(refreshBuffer) > 0;
    }

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public String authorizationHeader() {
        return "Bearer " + bearerValue;
    }

    @Override
    public String toString() {
        return "Credential[accountId=" + accountId
                + ", issuedAt=" + issuedAt
                + ", expiresAt=" + expiresAt
                + ", bearerValue=****]";
    }
}
