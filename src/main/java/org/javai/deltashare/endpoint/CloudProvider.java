package org.javai.deltashare.endpoint;

import java.util.Locale;
import java.util.Optional;

/**
 * Cloud providers whose managed workspace domains are accepted as destinations.
 */
public enum CloudProvider {

    AWS(".cloud.databricks.com"),
    AZURE(".azuredatabricks.net"),
    GCP(".gcp.databricks.com");

    private final String hostSuffix;

    CloudProvider(String hostSuffix) {
        this.hostSuffix = hostSuffix;
    }

    public String hostSuffix() {
        return hostSuffix;
    }

    /**
     * True when {@code host} is a subdomain of this provider's workspace domain.
     * The host must be lower-case.
     */
    public boolean matches(String host) {
        return host.length() > hostSuffix.length() && host.endsWith(hostSuffix);
    }

    public static Optional<CloudProvider> forHost(String host) {
        if (host == null) {
            return Optional.empty();
        }
        String normalized = host.toLowerCase(Locale.ROOT);
        for (CloudProvider provider : values()) {
            if (provider.matches(normalized)) {
                return Optional.of(provider);
            }
        }
        return Optional.empty();
    }
}
