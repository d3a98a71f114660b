package org.javai.deltashare.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Holds the single bearer credential for one account and refreshes it before it expires.
 *
 * <p>Reads of a credential that is still outside the refresh buffer take no lock. When the
 * held credential is absent or inside the buffer, exactly one caller performs the
 * acquisition; every other caller that arrives meanwhile waits for that same acquisition
 * and receives the same credential, or the same exception.
 *
 * <p>The lock only guards the hand-off of the in-flight acquisition; it is never held
 * while the token source talks to the network.
 *
 * <p>Callers pass the current instant explicitly, so expiry behaviour is driven entirely
 * by the caller's clock:
 * <pre>{@code
 * TokenCache cache = new TokenCache(source, Duration.ofMinutes(5));
 * Credential credential = cache.getCredential(clock.instant());
 * }</pre>
 */
public class TokenCache {

    private static final Logger log = LoggerFactory.getLogger(TokenCache.class);

    public static final Duration DEFAULT_REFRESH_BUFFER = Duration.ofMinutes(5);

    private final TokenSource source;
    private final Duration refreshBuffer;
    private final boolean serveStaleDuringRefresh;

    private final ReentrantLock lock = new ReentrantLock();
    private volatile Credential current;
    // guarded by lock
    private CompletableFuture<Credential> inFlight;

    public TokenCache(TokenSource source) {
        this(source, DEFAULT_REFRESH_BUFFER, false);
    }

    public TokenCache(TokenSource source, Duration refreshBuffer) {
        this(source, refreshBuffer, false);
    }

    /**
     * @param source performs the network acquisition
     * @param refreshBuffer how long before expiry a credential stops being handed out
     * @param serveStaleDuringRefresh when true, callers arriving while a proactive refresh is
     *        in flight get the previous credential as long as it has not actually expired
     */
    public TokenCache(TokenSource source, Duration refreshBuffer, boolean serveStaleDuringRefresh) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.refreshBuffer = Objects.requireNonNull(refreshBuffer, "refreshBuffer must not be null");
        if (refreshBuffer.isNegative()) {
            throw new IllegalArgumentException("refreshBuffer must not be negative");
        }
        this.serveStaleDuringRefresh = serveStaleDuringRefresh;
    }

    /**
     * Returns a credential valid for more than the refresh buffer past {@code now},
     * acquiring one if needed.
     *
     * @param now the caller's current instant
     * @return a live credential
     * @throws TokenAcquisitionException if the acquisition this call depends on failed
     */
    public Credential getCredential(Instant now) throws TokenAcquisitionException {
        Objects.requireNonNull(now, "now must not be null");

        Credential held = current;
        if (held != null && held.isUsableAt(now, refreshBuffer)) {
            return held;
        }

        CompletableFuture<Credential> flight;
        boolean leader = false;
        lock.lock();
        try {
            held = current;
            if (held != null && held.isUsableAt(now, refreshBuffer)) {
                return held;
            }
            if (inFlight == null) {
                inFlight = new CompletableFuture<>();
                leader = true;
            } else if (serveStaleDuringRefresh && held != null && !held.isExpiredAt(now)) {
                log.debug("Refresh in flight, serving previous credential (expires in {}s)",
                        held.remainingAt(now).toSeconds());
                return held;
            }
            flight = inFlight;
        } finally {
            lock.unlock();
        }

        if (leader) {
            return acquire(now, held, flight);
        }
        return await(flight);
    }

    private Credential acquire(Instant now, Credential previous, CompletableFuture<Credential> flight)
            throws TokenAcquisitionException {
        if (previous == null) {
            log.info("No cached token, generating new authentication token");
        } else {
            log.info("Cached token expires soon, generating new token (expires in {}s)",
                    previous.remainingAt(now).toSeconds());
        }

        Credential fresh;
        try {
            fresh = source.acquire(now);
            if (fresh == null) {
                throw new TokenAcquisitionException(TokenAcquisitionException.Reason.MALFORMED_RESPONSE,
                        "Token source returned no credential");
            }
            if (!fresh.isUsableAt(now, refreshBuffer)) {
                throw new TokenAcquisitionException(TokenAcquisitionException.Reason.LIFETIME_TOO_SHORT,
                        "Issued token lifetime " + fresh.remainingAt(now).toSeconds()
                                + "s does not exceed refresh buffer " + refreshBuffer.toSeconds() + "s");
            }
        } catch (Throwable t) {
            release(flight, null);
            flight.completeExceptionally(t);
            log.warn("Token acquisition failed: {}", t.getMessage());
            throw t;
        }

        release(flight, fresh);
        flight.complete(fresh);
        log.info("New token cached successfully, expires at {}", fresh.expiresAt());
        return fresh;
    }

    private void release(CompletableFuture<Credential> flight, Credential fresh) {
        lock.lock();
        try {
            if (fresh != null) {
                current = fresh;
            }
            if (inFlight == flight) {
                inFlight = null;
            }
        } finally {
            lock.unlock();
        }
    }

    private static Credential await(CompletableFuture<Credential> flight) throws TokenAcquisitionException {
        try {
            return flight.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TokenAcquisitionException(TokenAcquisitionException.Reason.INTERRUPTED,
                    "Interrupted while waiting for token acquisition", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TokenAcquisitionException tae) {
                throw tae;
            }
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new TokenAcquisitionException(TokenAcquisitionException.Reason.NETWORK,
                    "Token acquisition failed: " + cause, cause);
        }
    }

    /**
     * Drops the held credential so the next call acquires a new one.
     */
    public void invalidate() {
        lock.lock();
        try {
            current = null;
            log.info("Token invalidated manually");
        } finally {
            lock.unlock();
        }
    }

    public Optional<Credential> cachedCredential() {
        return Optional.ofNullable(current);
    }

    /**
     * True when a credential is held and is outside the refresh buffer at {@code now}.
     */
    public boolean isValidAt(Instant now) {
        Credential held = current;
        return held != null && held.isUsableAt(now, refreshBuffer);
    }

    public Duration refreshBuffer() {
        return refreshBuffer;
    }
}
