package org.javai.deltashare.endpoint;

import java.io.IOException;
import java.net.URI;

/**
 * Checks that something answers at an address. Any response counts; only the
 * absence of one is a failure.
 */
@FunctionalInterface
public interface ReachabilityProbe {

    /**
     * @param target the origin to probe
     * @throws IOException if nothing answered within the probe's timeout
     * @throws InterruptedException if the calling thread was interrupted while waiting
     */
    void probe(URI target) throws IOException, InterruptedException;
}
