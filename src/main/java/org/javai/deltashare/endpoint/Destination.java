package org.javai.deltashare.endpoint;

import java.net.URI;
import java.util.Objects;

/**
 * A workspace address that passed validation for the current request.
 * Never cached: every request validates its own destination.
 *
 * @param rawAddress The address as the caller supplied it
 * @param uri The parsed address
 * @param scheme Always {@code https}
 * @param host Lower-case host name
 * @param provider The cloud provider whose domain the host belongs to
 */
public record Destination(
        String rawAddress,
        URI uri,
        String scheme,
        String host,
        CloudProvider provider
) {

    public Destination {
        Objects.requireNonNull(rawAddress, "rawAddress must not be null");
        Objects.requireNonNull(uri, "uri must not be null");
        Objects.requireNonNull(scheme, "scheme must not be null");
        Objects.requireNonNull(host, "host must not be null");
        Objects.requireNonNull(provider, "provider must not be null");
    }

    /**
     * The scheme and host with no path, used as the SDK host and the probe target.
     */
    public URI origin() {
        return URI.create(scheme + "://" + host + "/");
    }
}
