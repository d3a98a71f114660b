package org.javai.deltashare.endpoint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.InetAddress;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.javai.deltashare.ops.OpReporterUtils.printable;

/**
 * Decides whether a caller-supplied workspace address may receive a credentialed call.
 *
 * <p>Validation runs in two stages. The syntactic stage rejects anything that is not an
 * {@code https} URL on one of the accepted provider domains with
 * {@link InvalidEndpointException}. The liveness stage resolves the host and sends a
 * probe to its origin, each step bounded by the probe timeout; if either step fails
 * the address is rejected with {@link EndpointUnreachableException}.
 *
 * <p>Nothing is cached between calls. The validator never sees credentials.
 */
public class EndpointValidator {

    private static final Logger log = LoggerFactory.getLogger(EndpointValidator.class);

    private static final String SECURE_SCHEME = "https";
    private static final int SECURE_PORT = 443;

    // Lookups that outlive their deadline keep running here and must not pin the JVM.
    private static final ExecutorService RESOLVER_POOL = Executors.newCachedThreadPool(new ThreadFactory() {
        private final AtomicInteger counter = new AtomicInteger(0);

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "workspace-dns-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    });

    private final Set<CloudProvider> acceptedProviders;
    private final HostResolver resolver;
    private final ReachabilityProbe probe;
    private final Duration resolveTimeout;

    /**
     * Creates a validator accepting all providers, with the system resolver and an HTTP
     * probe using the default timeout.
     */
    public EndpointValidator() {
        this(EnumSet.allOf(CloudProvider.class), HostResolver.system(), new HttpReachabilityProbe());
    }

    public EndpointValidator(Set<CloudProvider> acceptedProviders, HostResolver resolver, ReachabilityProbe probe) {
        this(acceptedProviders, resolver, probe, HttpReachabilityProbe.DEFAULT_TIMEOUT);
    }

    /**
     * @param resolveTimeout upper bound on host name resolution
     */
    public EndpointValidator(Set<CloudProvider> acceptedProviders, HostResolver resolver, ReachabilityProbe probe,
                             Duration resolveTimeout) {
        Objects.requireNonNull(acceptedProviders, "acceptedProviders must not be null");
        if (acceptedProviders.isEmpty()) {
            throw new IllegalArgumentException("acceptedProviders must not be empty");
        }
        this.acceptedProviders = Set.copyOf(EnumSet.copyOf(acceptedProviders));
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.probe = Objects.requireNonNull(probe, "probe must not be null");
        this.resolveTimeout = Objects.requireNonNull(resolveTimeout, "resolveTimeout must not be null");
        if (resolveTimeout.isZero() || resolveTimeout.isNegative()) {
            throw new IllegalArgumentException("resolveTimeout must be positive");
        }
    }

    /**
     * Validates the address syntactically and checks that the workspace answers.
     *
     * @param rawAddress the workspace URL as supplied by the caller
     * @return the accepted destination
     * @throws InvalidEndpointException if the address is malformed or not an accepted workspace URL
     * @throws EndpointUnreachableException if the host does not resolve or does not answer in time
     */
    public Destination validate(String rawAddress) throws InvalidEndpointException, EndpointUnreachableException {
        Destination destination = parse(rawAddress);
        checkReachable(destination);
        log.debug("Accepted workspace {} ({})", destination.host(), destination.provider());
        return destination;
    }

    /**
     * Runs only the syntactic checks. No network access.
     */
    public Destination parse(String rawAddress) throws InvalidEndpointException {
        if (rawAddress == null || rawAddress.isBlank()) {
            throw invalid(rawAddress, "Workspace URL must not be empty");
        }
        String trimmed = rawAddress.trim();

        URI uri;
        try {
            uri = new URI(trimmed);
        } catch (URISyntaxException e) {
            throw new InvalidEndpointException(rawAddress, "Workspace URL is not a valid URL: " + e.getReason(), e);
        }

        String scheme = uri.getScheme();
        if (scheme == null) {
            throw invalid(rawAddress, "Workspace URL must be absolute");
        }
        if (!SECURE_SCHEME.equalsIgnoreCase(scheme)) {
            throw invalid(rawAddress, "Workspace URL must use https, got " + scheme);
        }
        if (uri.getHost() == null) {
            throw invalid(rawAddress, "Workspace URL has no valid host");
        }
        if (uri.getRawUserInfo() != null) {
            throw invalid(rawAddress, "Workspace URL must not contain user info");
        }
        if (uri.getPort() != -1 && uri.getPort() != SECURE_PORT) {
            throw invalid(rawAddress, "Workspace URL must use port 443, got " + uri.getPort());
        }

        String host = uri.getHost().toLowerCase(Locale.ROOT);
        CloudProvider provider = providerFor(host);
        if (provider == null) {
            throw invalid(rawAddress, "Host " + host + " is not a recognized Databricks workspace domain");
        }
        return new Destination(rawAddress, uri, SECURE_SCHEME, host, provider);
    }

    private CloudProvider providerFor(String host) {
        // enum order keeps the match deterministic
        for (CloudProvider provider : CloudProvider.values()) {
            if (acceptedProviders.contains(provider) && provider.matches(host)) {
                return provider;
            }
        }
        return null;
    }

    private void checkReachable(Destination destination) throws EndpointUnreachableException {
        String address = destination.rawAddress();
        String host = destination.host();

        List<InetAddress> addresses = resolve(address, host);
        if (addresses == null || addresses.isEmpty()) {
            throw unreachable(address, UnreachableReason.DNS_RESOLUTION_FAILED,
                    "Unable to resolve Databricks workspace host " + host, null);
        }

        try {
            probe.probe(destination.origin());
        } catch (HttpTimeoutException | SocketTimeoutException e) {
            throw unreachable(address, UnreachableReason.TIMED_OUT,
                    "Connection to Databricks workspace " + host + " timed out", e);
        } catch (ConnectException e) {
            throw unreachable(address, UnreachableReason.CONNECTION_REFUSED,
                    "Connection to Databricks workspace " + host + " was refused", e);
        } catch (SSLException e) {
            throw unreachable(address, UnreachableReason.TLS_FAILURE,
                    "SSL/TLS error connecting to Databricks workspace " + host, e);
        } catch (IOException e) {
            throw unreachable(address, UnreachableReason.PROBE_FAILED,
                    "Unable to connect to Databricks workspace " + host + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw unreachable(address, UnreachableReason.PROBE_FAILED,
                    "Interrupted while probing Databricks workspace " + host, e);
        }
    }

    private List<InetAddress> resolve(String address, String host) throws EndpointUnreachableException {
        Future<List<InetAddress>> lookup = RESOLVER_POOL.submit(() -> resolver.resolve(host));
        try {
            return lookup.get(resolveTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            lookup.cancel(true);
            throw unreachable(address, UnreachableReason.TIMED_OUT,
                    "Resolving Databricks workspace host " + host + " timed out after "
                            + resolveTimeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            lookup.cancel(true);
            Thread.currentThread().interrupt();
            throw unreachable(address, UnreachableReason.DNS_RESOLUTION_FAILED,
                    "Interrupted while resolving Databricks workspace host " + host, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw unreachable(address, UnreachableReason.DNS_RESOLUTION_FAILED,
                    "Unable to resolve Databricks workspace host " + host, cause);
        }
    }

    private static InvalidEndpointException invalid(String address, String message) {
        log.warn("Rejected workspace URL [{}]: {}", printable(address), printable(message));
        return new InvalidEndpointException(address, message);
    }

    private static EndpointUnreachableException unreachable(String address, UnreachableReason reason,
                                                            String message, Throwable cause) {
        log.warn("Workspace unreachable [{}]: {} ({})", printable(address), printable(message), reason);
        return new EndpointUnreachableException(address, reason, message, cause);
    }

    public Set<CloudProvider> acceptedProviders() {
        return acceptedProviders;
    }

    public Duration resolveTimeout() {
        return resolveTimeout;
    }
}
