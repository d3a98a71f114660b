package org.javai.deltashare.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Objects;

/**
 * Acquires account-level access tokens with the OAuth2 client-credentials grant.
 *
 * <p>The request is a form-encoded {@code POST} authenticated with HTTP Basic
 * (client id and secret). The response must carry {@code access_token} and a
 * positive {@code expires_in}.
 */
public class ClientCredentialsTokenSource implements TokenSource {

    private static final Logger log = LoggerFactory.getLogger(ClientCredentialsTokenSource.class);

    static final String DEFAULT_ENDPOINT_TEMPLATE =
            "https://accounts.azuredatabricks.net/oidc/accounts/%s/v1/token";
    static final String DEFAULT_SCOPE = "all-apis";
    private static final Duration TIMEOUT = Duration.ofSeconds(30);
    // longer lifetimes are treated as a malformed response
    static final long MAX_LIFETIME_SECONDS = Duration.ofDays(365).toSeconds();

    private final URI tokenEndpoint;
    private final String clientId;
    private final String clientSecret;
    private final String accountId;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    /**
     * Creates a source for the account's default token endpoint.
     */
    public ClientCredentialsTokenSource(String clientId, String clientSecret, String accountId) {
        this(defaultEndpointFor(accountId), clientId, clientSecret, accountId);
    }

    public ClientCredentialsTokenSource(URI tokenEndpoint, String clientId, String clientSecret, String accountId) {
        this(tokenEndpoint, clientId, clientSecret, accountId,
                HttpClient.newBuilder().connectTimeout(TIMEOUT).build(),
                new ObjectMapper());
    }

    /**
     * Creates a source with a custom HttpClient and ObjectMapper.
     * Useful for testing.
     */
    ClientCredentialsTokenSource(URI tokenEndpoint, String clientId, String clientSecret, String accountId,
                                 HttpClient httpClient, ObjectMapper objectMapper) {
        this.tokenEndpoint = Objects.requireNonNull(tokenEndpoint, "tokenEndpoint must not be null");
        this.clientId = requireNonEmpty(clientId, "clientId");
        this.clientSecret = requireNonEmpty(clientSecret, "clientSecret");
        this.accountId = requireNonEmpty(accountId, "accountId");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    public static URI defaultEndpointFor(String accountId) {
        return URI.create(DEFAULT_ENDPOINT_TEMPLATE.formatted(requireNonEmpty(accountId, "accountId")));
    }

    public URI tokenEndpoint() {
        return tokenEndpoint;
    }

    @Override
    public Credential acquire(Instant now) throws TokenAcquisitionException {
        HttpResponse<String> response = send(buildRequest());

        int status = response.statusCode();
        if (status < 200 || status > 299) {
            log.error("Token request rejected by {}: status={}", tokenEndpoint, status);
            throw new TokenAcquisitionException(TokenAcquisitionException.Reason.REJECTED,
                    "Token request failed with status " + status + ": " + abbreviate(response.body()),
                    status, null);
        }

        TokenResponse token = parse(response.body());
        if (token.accessToken() == null || token.accessToken().isBlank()) {
            throw new TokenAcquisitionException(TokenAcquisitionException.Reason.MALFORMED_RESPONSE,
                    "Access token not found in token response");
        }
        if (token.expiresIn() == null || token.expiresIn() <= 0) {
            throw new TokenAcquisitionException(TokenAcquisitionException.Reason.MALFORMED_RESPONSE,
                    "Token response has no positive expires_in: " + token.expiresIn());
        }
        if (token.expiresIn() > MAX_LIFETIME_SECONDS) {
            throw new TokenAcquisitionException(TokenAcquisitionException.Reason.MALFORMED_RESPONSE,
                    "Token response expires_in out of range: " + token.expiresIn());
        }

        Credential credential = new Credential(token.accessToken(), now,
                now.plusSeconds(token.expiresIn()), accountId);
        log.debug("Acquired token for account {} valid for {}s", accountId, token.expiresIn());
        return credential;
    }

    private HttpRequest buildRequest() {
        String basic = Base64.getEncoder()
                .encodeToString((clientId + ":" + clientSecret).getBytes(StandardCharsets.UTF_8));
        String form = "grant_type=client_credentials&scope=" + URLEncoder.encode(DEFAULT_SCOPE, StandardCharsets.UTF_8);
        return HttpRequest.newBuilder()
                .uri(tokenEndpoint)
                .timeout(TIMEOUT)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .header("Accept", "application/json")
                .header("Authorization", "Basic " + basic)
                .POST(HttpRequest.BodyPublishers.ofString(form))
                .build();
    }

    private HttpResponse<String> send(HttpRequest request) throws TokenAcquisitionException {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            log.error("Token request to {} failed: {}", tokenEndpoint, e.toString());
            throw new TokenAcquisitionException(TokenAcquisitionException.Reason.NETWORK,
                    "Network error requesting token: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TokenAcquisitionException(TokenAcquisitionException.Reason.INTERRUPTED,
                    "Interrupted while requesting token", e);
        }
    }

    private TokenResponse parse(String body) throws TokenAcquisitionException {
        if (body == null || body.isBlank()) {
            throw new TokenAcquisitionException(TokenAcquisitionException.Reason.MALFORMED_RESPONSE,
                    "Failed to parse token response: empty body");
        }
        try {
            TokenResponse token = objectMapper.readValue(body, TokenResponse.class);
            if (token == null) {
                throw new TokenAcquisitionException(TokenAcquisitionException.Reason.MALFORMED_RESPONSE,
                        "Failed to parse token response: null document");
            }
            return token;
        } catch (JsonProcessingException e) {
            throw new TokenAcquisitionException(TokenAcquisitionException.Reason.MALFORMED_RESPONSE,
                    "Failed to parse token response: " + e.getOriginalMessage(), e);
        }
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }

    private static String requireNonEmpty(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be null or empty");
        }
        return value;
    }
}
