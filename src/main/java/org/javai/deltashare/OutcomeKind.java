package org.javai.deltashare;

/**
 * The closed set of failure kinds the route layer maps to client responses.
 *
 * <p>Each kind is bound to exactly one {@link OutcomeCategory}, a client-visible
 * HTTP status and a default detail message. Infrastructure and credential kinds
 * never share a status with the business kinds, so an outage cannot be reported
 * as "resource does not exist".
 */
public enum OutcomeKind {

    UNAUTHENTICATED(OutcomeCategory.BUSINESS, 401,
            "Databricks authentication failed. Please verify your credentials."),

    PERMISSION_DENIED(OutcomeCategory.BUSINESS, 403,
            "Access denied to the requested Databricks resource."),

    NOT_FOUND(OutcomeCategory.BUSINESS, 404,
            "The requested Databricks resource was not found."),

    CONFLICT(OutcomeCategory.BUSINESS, 409,
            "The Databricks resource already exists or is in a conflicting state."),

    BAD_REQUEST(OutcomeCategory.BUSINESS, 400,
            "Invalid request to Databricks."),

    UPSTREAM_UNAVAILABLE(OutcomeCategory.INFRASTRUCTURE, 502,
            "Databricks service error."),

    AUTH_ACQUISITION_FAILED(OutcomeCategory.CREDENTIAL, 502,
            "Unable to obtain a Databricks access token."),

    INVALID_ENDPOINT(OutcomeCategory.ENDPOINT, 400,
            "The Databricks workspace URL is not valid."),

    ENDPOINT_UNREACHABLE(OutcomeCategory.ENDPOINT, 503,
            "Unable to connect to the Databricks workspace. Please try again later.");

    private final OutcomeCategory category;
    private final int httpStatus;
    private final String detail;

    OutcomeKind(OutcomeCategory category, int httpStatus, String detail) {
        this.category = category;
        this.httpStatus = httpStatus;
        this.detail = detail;
    }

    public OutcomeCategory category() {
        return category;
    }

    /**
     * The HTTP status the route layer answers with for this kind.
     */
    public int httpStatus() {
        return httpStatus;
    }

    /**
     * Client-safe detail text. Never includes the underlying signal's message.
     */
    public String detail() {
        return detail;
    }

    /**
     * True for kinds that are a definite answer about the requested resource.
     */
    public boolean isBusinessAnswer() {
        return category == OutcomeCategory.BUSINESS;
    }
}
