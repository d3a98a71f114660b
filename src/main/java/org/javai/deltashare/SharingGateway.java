package org.javai.deltashare;

import org.javai.deltashare.auth.ClientCredentialsTokenSource;
import org.javai.deltashare.auth.Credential;
import org.javai.deltashare.auth.TokenCache;
import org.javai.deltashare.boundary.Boundary;
import org.javai.deltashare.boundary.SharingFailureClassifier;
import org.javai.deltashare.boundary.UpstreamCallException;
import org.javai.deltashare.config.GatewaySettings;
import org.javai.deltashare.endpoint.Destination;
import org.javai.deltashare.endpoint.EndpointValidator;
import org.javai.deltashare.endpoint.HostResolver;
import org.javai.deltashare.endpoint.HttpReachabilityProbe;
import org.javai.deltashare.ops.OpReporter;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Runs sharing operations in the required order: validate the workspace address,
 * obtain a credential, invoke the platform, classify any failure.
 *
 * <p>The platform call is never invoked unless both the workspace address and the
 * credential were obtained. Every failure, whichever step raised it, comes back as
 * an {@link Outcome.Fail} with a kind from {@link OutcomeKind}. Unchecked exceptions
 * thrown by the platform call are upstream failures and classify as
 * {@link OutcomeKind#UPSTREAM_UNAVAILABLE}.
 *
 * <pre>{@code
 * SharingGateway gateway = SharingGateway.fromSettings(GatewaySettings.fromEnvironment(),
 *         new Log4jOpReporter());
 *
 * Outcome<ShareInfo> share = gateway.execute("shares.get", workspaceUrl,
 *         (destination, credential) -> sharesClient.get(destination, credential, shareName));
 * }</pre>
 */
public final class SharingGateway {

    private final EndpointValidator validator;
    private final TokenCache tokenCache;
    private final Boundary boundary;
    private final Clock clock;
    private final String defaultWorkspaceUrl;

    public SharingGateway(EndpointValidator validator, TokenCache tokenCache, Boundary boundary, Clock clock) {
        this(validator, tokenCache, boundary, clock, null);
    }

    /**
     * @param defaultWorkspaceUrl workspace used by {@link #execute(String, CredentialedCall)}, may be null
     */
    public SharingGateway(EndpointValidator validator, TokenCache tokenCache, Boundary boundary, Clock clock,
                          String defaultWorkspaceUrl) {
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.tokenCache = Objects.requireNonNull(tokenCache, "tokenCache must not be null");
        this.boundary = Objects.requireNonNull(boundary, "boundary must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.defaultWorkspaceUrl = defaultWorkspaceUrl;
    }

    public static SharingGateway fromSettings(GatewaySettings settings, OpReporter reporter) {
        return fromSettings(settings, reporter, () -> null);
    }

    /**
     * Wires the production components from settings.
     *
     * @param correlationIdSupplier supplies the current request id for failure reports
     */
    public static SharingGateway fromSettings(GatewaySettings settings, OpReporter reporter,
                                              Supplier<String> correlationIdSupplier) {
        ClientCredentialsTokenSource source = new ClientCredentialsTokenSource(settings.tokenEndpoint(),
                settings.clientId(), settings.clientSecret(), settings.accountId());
        TokenCache cache = new TokenCache(source, settings.refreshBuffer(), settings.serveStaleDuringRefresh());
        EndpointValidator validator = new EndpointValidator(settings.acceptedProviders(),
                HostResolver.system(), new HttpReachabilityProbe(settings.probeTimeout()), settings.probeTimeout());
        Boundary boundary = new Boundary(new SharingFailureClassifier(), reporter, correlationIdSupplier);
        return new SharingGateway(validator, cache, boundary, Clock.systemUTC(),
                settings.defaultWorkspaceUrl().orElse(null));
    }

    /**
     * Runs {@code call} against the caller-supplied workspace.
     *
     * @param operation operation name used in failure reports (e.g. "shares.create")
     * @param workspaceUrl the workspace address supplied with the request
     * @param call the platform call
     */
    public <T> Outcome<T> execute(String operation, String workspaceUrl, CredentialedCall<T> call) {
        Objects.requireNonNull(call, "call must not be null");
        Map<String, String> tags = workspaceUrl == null ? Map.of() : Map.of("workspace", workspaceUrl);
        return boundary.call(operation, tags, () -> {
            Destination destination = validator.validate(workspaceUrl);
            Credential credential = tokenCache.getCredential(clock.instant());
            try {
                return call.invoke(destination, credential);
            } catch (RuntimeException e) {
                throw new UpstreamCallException(operation, e);
            }
        });
    }

    /**
     * Runs {@code call} against the configured default workspace.
     *
     * @throws IllegalStateException if no default workspace is configured
     */
    public <T> Outcome<T> execute(String operation, CredentialedCall<T> call) {
        if (defaultWorkspaceUrl == null) {
            throw new IllegalStateException("No default workspace URL configured");
        }
        return execute(operation, defaultWorkspaceUrl, call);
    }

    public TokenCache tokenCache() {
        return tokenCache;
    }
}
