package org.javai.deltashare.boundary;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * An error reported by the sharing platform's REST API.
 *
 * <p>Carries the HTTP status and, when the platform supplied one, its
 * {@code error_code} (e.g. {@code RESOURCE_DOES_NOT_EXIST}).
 */
public class SharingApiException extends Exception {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final int statusCode;
    private final String errorCode;

    public SharingApiException(int statusCode, String errorCode, String message) {
        this(statusCode, errorCode, message, null);
    }

    public SharingApiException(int statusCode, String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.errorCode = errorCode == null || errorCode.isBlank() ? null : errorCode;
    }

    /**
     * Builds the exception from an error response, reading the platform's JSON error
     * envelope ({@code {"error_code": "...", "message": "..."}}) when the body is one.
     */
    public static SharingApiException fromResponse(int statusCode, String body) {
        String errorCode = null;
        String message = null;
        if (body != null && !body.isBlank()) {
            try {
                JsonNode root = MAPPER.readTree(body);
                if (root != null && root.isObject()) {
                    errorCode = textOrNull(root.get("error_code"));
                    message = textOrNull(root.get("message"));
                }
            } catch (JsonProcessingException e) {
                message = body;
            }
        }
        if (message == null) {
            message = body == null || body.isBlank() ? "HTTP " + statusCode : body;
        }
        return new SharingApiException(statusCode, errorCode, message);
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }

    public int statusCode() {
        return statusCode;
    }

    /**
     * The platform's error code, or null when none was reported.
     */
    public String errorCode() {
        return errorCode;
    }
}
