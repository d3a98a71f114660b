package org.javai.deltashare.boundary;

import org.javai.deltashare.ClassifiedOutcome;
import org.javai.deltashare.OutcomeKind;
import org.javai.deltashare.auth.TokenAcquisitionException;
import org.javai.deltashare.endpoint.EndpointUnreachableException;
import org.javai.deltashare.endpoint.InvalidEndpointException;

import java.util.Locale;
import java.util.Map;

/**
 * Collapses failures of a sharing operation into the {@link OutcomeKind} taxonomy.
 *
 * <p>Checks run in a fixed order and the first match wins:
 * <ol>
 *   <li>signals raised by the credential and endpoint layers;</li>
 *   <li>the error code reported by the sharing platform;</li>
 *   <li>the HTTP status reported by the sharing platform;</li>
 *   <li>anything else, which is an upstream failure.</li>
 * </ol>
 * A reported error code therefore always wins over a status that disagrees with it.
 */
public class SharingFailureClassifier implements FailureClassifier {

    private static final Map<String, OutcomeKind> ERROR_CODES = Map.ofEntries(
            Map.entry("UNAUTHENTICATED", OutcomeKind.UNAUTHENTICATED),
            Map.entry("PERMISSION_DENIED", OutcomeKind.PERMISSION_DENIED),
            Map.entry("RESOURCE_DOES_NOT_EXIST", OutcomeKind.NOT_FOUND),
            Map.entry("NOT_FOUND", OutcomeKind.NOT_FOUND),
            Map.entry("RESOURCE_ALREADY_EXISTS", OutcomeKind.CONFLICT),
            Map.entry("ALREADY_EXISTS", OutcomeKind.CONFLICT),
            Map.entry("RESOURCE_CONFLICT", OutcomeKind.CONFLICT),
            Map.entry("INVALID_STATE", OutcomeKind.CONFLICT),
            Map.entry("ABORTED", OutcomeKind.CONFLICT),
            Map.entry("INVALID_PARAMETER_VALUE", OutcomeKind.BAD_REQUEST),
            Map.entry("MALFORMED_REQUEST", OutcomeKind.BAD_REQUEST),
            Map.entry("BAD_REQUEST", OutcomeKind.BAD_REQUEST),
            Map.entry("INVALID_REQUEST", OutcomeKind.BAD_REQUEST),
            Map.entry("INTERNAL_ERROR", OutcomeKind.UPSTREAM_UNAVAILABLE),
            Map.entry("TEMPORARILY_UNAVAILABLE", OutcomeKind.UPSTREAM_UNAVAILABLE),
            Map.entry("REQUEST_LIMIT_EXCEEDED", OutcomeKind.UPSTREAM_UNAVAILABLE),
            Map.entry("DEADLINE_EXCEEDED", OutcomeKind.UPSTREAM_UNAVAILABLE),
            Map.entry("UNAVAILABLE", OutcomeKind.UPSTREAM_UNAVAILABLE)
    );

    @Override
    public ClassifiedOutcome classify(String operation, Throwable signal) {
        if (signal == null) {
            NullPointerException missing = new NullPointerException("no failure signal for " + operation);
            return ClassifiedOutcome.of(OutcomeKind.UPSTREAM_UNAVAILABLE, "Missing failure signal", missing);
        }

        // Credential and endpoint layers
        if (signal instanceof TokenAcquisitionException tae) {
            return ClassifiedOutcome.of(OutcomeKind.AUTH_ACQUISITION_FAILED,
                    messageFor("Token acquisition failed (" + tae.reason() + ")", signal), signal);
        }

        if (signal instanceof InvalidEndpointException) {
            return ClassifiedOutcome.of(OutcomeKind.INVALID_ENDPOINT,
                    messageFor("Invalid workspace URL", signal), signal);
        }

        if (signal instanceof EndpointUnreachableException eue) {
            return ClassifiedOutcome.of(OutcomeKind.ENDPOINT_UNREACHABLE,
                    messageFor("Workspace unreachable (" + eue.reason() + ")", signal), signal);
        }

        // Platform-reported category, then status
        if (signal instanceof SharingApiException api) {
            return classifyApiError(api);
        }

        if (signal instanceof UpstreamCallException upstream) {
            return ClassifiedOutcome.of(OutcomeKind.UPSTREAM_UNAVAILABLE,
                    messageFor("Databricks call failed", upstream.getCause()), signal);
        }

        return classifyUnknown(signal);
    }

    private static ClassifiedOutcome classifyApiError(SharingApiException api) {
        if (api.errorCode() != null) {
            OutcomeKind byCode = ERROR_CODES.get(api.errorCode().toUpperCase(Locale.ROOT));
            if (byCode != null) {
                return ClassifiedOutcome.of(byCode,
                        messageFor("Databricks error " + api.errorCode(), api), api);
            }
        }
        return ClassifiedOutcome.of(kindForStatus(api.statusCode()),
                messageFor("Databricks API error (HTTP " + api.statusCode() + ")", api), api);
    }

    private static OutcomeKind kindForStatus(int status) {
        return switch (status) {
            case 401 -> OutcomeKind.UNAUTHENTICATED;
            case 403 -> OutcomeKind.PERMISSION_DENIED;
            case 404 -> OutcomeKind.NOT_FOUND;
            case 409 -> OutcomeKind.CONFLICT;
            case 400, 422 -> OutcomeKind.BAD_REQUEST;
            default -> OutcomeKind.UPSTREAM_UNAVAILABLE;
        };
    }

    private static ClassifiedOutcome classifyUnknown(Throwable signal) {
        String message = signal.getMessage() != null ? signal.getMessage() : signal.getClass().getName();
        return ClassifiedOutcome.of(OutcomeKind.UPSTREAM_UNAVAILABLE,
                "Databricks service error: " + message, signal);
    }

    private static String messageFor(String prefix, Throwable t) {
        return prefix + ": " + t.getMessage();
    }
}
