package com.zaruka.providers;

/**
 * Raised by model handles. The message keeps the provider's raw error text so
 * callers (and the error classifier) can key off it.
 */
public class ModelInvocationException extends RuntimeException {

    private final String providerId;
    private final int statusCode;

    public ModelInvocationException(String providerId, int statusCode, String message) {
        super(message);
        this.providerId = providerId;
        this.statusCode = statusCode;
    }

    public ModelInvocationException(String providerId, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.providerId = providerId;
        this.statusCode = statusCode;
    }

    public static ModelInvocationException httpError(String providerId, int statusCode, String body) {
        return new ModelInvocationException(providerId, statusCode,
                "LLM API error " + statusCode + ": " + body);
    }

    public String providerId() {
        return providerId;
    }

    /** HTTP status, or 0 when the failure did not come with one. */
    public int statusCode() {
        return statusCode;
    }
}
