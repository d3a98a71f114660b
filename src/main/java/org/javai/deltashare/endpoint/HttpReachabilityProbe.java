package org.javai.deltashare.endpoint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * Probes an address with an HTTP {@code HEAD} request bounded by a timeout.
 * Any status code, including 401 and 404, means the host is reachable.
 */
public class HttpReachabilityProbe implements ReachabilityProbe {

    private static final Logger log = LoggerFactory.getLogger(HttpReachabilityProbe.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private final Duration timeout;
    private final HttpClient httpClient;

    public HttpReachabilityProbe() {
        this(DEFAULT_TIMEOUT);
    }

    public HttpReachabilityProbe(Duration timeout) {
        this(timeout, HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build());
    }

    /**
     * Creates a probe with a custom HttpClient.
     * Useful for testing.
     */
    HttpReachabilityProbe(Duration timeout, HttpClient httpClient) {
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
    }

    @Override
    public void probe(URI target) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(target)
                .timeout(timeout)
                .method("HEAD", HttpRequest.BodyPublishers.noBody())
                .build();
        HttpResponse<Void> response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
        log.debug("Probe of {} answered with status {}", target, response.statusCode());
    }

    public Duration timeout() {
        return timeout;
    }
}
