package org.javai.deltashare.config;

import org.javai.deltashare.auth.ClientCredentialsTokenSource;
import org.javai.deltashare.auth.TokenCache;
import org.javai.deltashare.endpoint.CloudProvider;
import org.javai.deltashare.endpoint.HttpReachabilityProbe;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Settings read once at process start.
 *
 * <p>Each value is resolved from a system property first, then an environment variable:
 * <ul>
 *   <li>{@code deltashare.client.id} / {@code CLIENT_ID} (required)</li>
 *   <li>{@code deltashare.client.secret} / {@code CLIENT_SECRET} (required)</li>
 *   <li>{@code deltashare.account.id} / {@code ACCOUNT_ID} (required)</li>
 *   <li>{@code deltashare.token.endpoint} / {@code TOKEN_ENDPOINT} (default: the account's OIDC endpoint)</li>
 *   <li>{@code deltashare.token.refresh-buffer} / {@code TOKEN_REFRESH_BUFFER} (default {@code PT5M})</li>
 *   <li>{@code deltashare.token.serve-stale} / {@code TOKEN_SERVE_STALE} (default {@code false})</li>
 *   <li>{@code deltashare.endpoint.probe-timeout} / {@code ENDPOINT_PROBE_TIMEOUT} (default {@code PT5S})</li>
 *   <li>{@code deltashare.endpoint.providers} / {@code ENDPOINT_PROVIDERS} (default {@code AWS,AZURE,GCP})</li>
 *   <li>{@code deltashare.workspace.url} / {@code DLTSHR_WORKSPACE_URL} (optional)</li>
 * </ul>
 */
public record GatewaySettings(
        String clientId,
        String clientSecret,
        String accountId,
        URI tokenEndpoint,
        Duration refreshBuffer,
        boolean serveStaleDuringRefresh,
        Duration probeTimeout,
        Set<CloudProvider> acceptedProviders,
        Optional<String> defaultWorkspaceUrl
) {

    public GatewaySettings {
        Objects.requireNonNull(clientId, "clientId must not be null");
        Objects.requireNonNull(clientSecret, "clientSecret must not be null");
        Objects.requireNonNull(accountId, "accountId must not be null");
        Objects.requireNonNull(tokenEndpoint, "tokenEndpoint must not be null");
        Objects.requireNonNull(refreshBuffer, "refreshBuffer must not be null");
        Objects.requireNonNull(probeTimeout, "probeTimeout must not be null");
        Objects.requireNonNull(acceptedProviders, "acceptedProviders must not be null");
        Objects.requireNonNull(defaultWorkspaceUrl, "defaultWorkspaceUrl must not be null, use Optional.empty()");
        if (acceptedProviders.isEmpty()) {
            throw new IllegalArgumentException("acceptedProviders must not be empty");
        }
        acceptedProviders = Set.copyOf(acceptedProviders);
    }

    public static GatewaySettings fromEnvironment() {
        return load(ConfigResolver.system());
    }

    public static GatewaySettings load(ConfigResolver config) {
        String accountId = config.required("deltashare.account.id", "ACCOUNT_ID");
        URI tokenEndpoint = config.optional("deltashare.token.endpoint", "TOKEN_ENDPOINT")
                .map(GatewaySettings::parseEndpoint)
                .orElseGet(() -> ClientCredentialsTokenSource.defaultEndpointFor(accountId));

        return new GatewaySettings(
                config.required("deltashare.client.id", "CLIENT_ID"),
                config.required("deltashare.client.secret", "CLIENT_SECRET"),
                accountId,
                tokenEndpoint,
                config.duration("deltashare.token.refresh-buffer", "TOKEN_REFRESH_BUFFER",
                        TokenCache.DEFAULT_REFRESH_BUFFER),
                config.flag("deltashare.token.serve-stale", "TOKEN_SERVE_STALE", false),
                config.duration("deltashare.endpoint.probe-timeout", "ENDPOINT_PROBE_TIMEOUT",
                        HttpReachabilityProbe.DEFAULT_TIMEOUT),
                config.optional("deltashare.endpoint.providers", "ENDPOINT_PROVIDERS")
                        .map(GatewaySettings::parseProviders)
                        .orElseGet(() -> EnumSet.allOf(CloudProvider.class)),
                config.optional("deltashare.workspace.url", "DLTSHR_WORKSPACE_URL"));
    }

    private static URI parseEndpoint(String value) {
        URI uri;
        try {
            uri = new URI(value);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("deltashare.token.endpoint is not a valid URL: " + value, e);
        }
        if (uri.getScheme() == null || uri.getHost() == null) {
            throw new IllegalArgumentException("deltashare.token.endpoint must be an absolute URL, got " + value);
        }
        return uri;
    }

    private static Set<CloudProvider> parseProviders(String value) {
        EnumSet<CloudProvider> providers = EnumSet.noneOf(CloudProvider.class);
        for (String part : value.split(",")) {
            String name = part.trim();
            if (name.isEmpty()) {
                continue;
            }
            try {
                providers.add(CloudProvider.valueOf(name.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("deltashare.endpoint.providers has unknown provider: " + name, e);
            }
        }
        if (providers.isEmpty()) {
            throw new IllegalArgumentException("deltashare.endpoint.providers must name at least one provider");
        }
        return providers;
    }

    @Override
    public String toString() {
        return "GatewaySettings[clientId=" + clientId
                + ", clientSecret=****"
                + ", accountId=" + accountId
                + ", tokenEndpoint=" + tokenEndpoint
                + ", refreshBuffer=" + refreshBuffer
                + ", serveStaleDuringRefresh=" + serveStaleDuringRefresh
                + ", probeTimeout=" + probeTimeout
                + ", acceptedProviders=" + acceptedProviders
                + ", defaultWorkspaceUrl=" + defaultWorkspaceUrl.orElse("none") + "]";
    }
}
