package org.javai.deltashare.endpoint;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;

/**
 * Resolves a host name to its addresses.
 */
@FunctionalInterface
public interface HostResolver {

    /**
     * @throws UnknownHostException if the name does not resolve
     */
    List<InetAddress> resolve(String host) throws UnknownHostException;

    /**
     * Resolver backed by the JVM's system resolver. Blocks for as long as the OS resolver
     * retries; {@link EndpointValidator} bounds the wait.
     */
    static HostResolver system() {
        return host -> List.of(InetAddress.getAllByName(host));
    }
}
