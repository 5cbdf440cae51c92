package com.prodomme.providers.chat;

/**
 * Failure of a provider query. Never retried automatically; the session rolls the
 * turn back and the caller decides whether to send again.
 */
public class InferenceException extends Exception {

    public enum Kind {
        MISSING_API_KEY,
        NETWORK_ERROR,
        API_ERROR,
        INVALID_RESPONSE,
        SERIALIZATION_ERROR
    }

    private final Kind kind;
    private final String provider;
    private final int status;
    private final String body;

    public InferenceException(Kind kind, String provider, String message, int status, String body, Throwable cause) {
        super(provider + " inference error: " + message, cause);
        this.kind = kind;
        this.provider = provider;
        this.status = status;
        this.body = body;
    }

    public static InferenceException missingApiKey(String provider) {
        return new InferenceException(Kind.MISSING_API_KEY, provider, "API key not found", 0, null, null);
    }

    public static InferenceException network(String provider, Throwable cause) {
        String detail = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new InferenceException(Kind.NETWORK_ERROR, provider, "request failed: " + detail, 0, null, cause);
    }

    public static InferenceException api(String provider, int status, String body) {
        return new InferenceException(Kind.API_ERROR, provider, "request failed (" + status + "): " + body,
            status, body, null);
    }

    public static InferenceException invalidResponse(String provider, String detail, Throwable cause) {
        return new InferenceException(Kind.INVALID_RESPONSE, provider, detail, 0, null, cause);
    }

    public static InferenceException serialization(String provider, String detail, Throwable cause) {
        return new InferenceException(Kind.SERIALIZATION_ERROR, provider, detail, 0, null, cause);
    }

    public Kind getKind() {
        return kind;
    }

    public String getProvider() {
        return provider;
    }

    /**
     * @return HTTP status for {@link Kind#API_ERROR}, otherwise 0
     */
    public int getStatus() {
        return status;
    }

    /**
     * @return raw response body for {@link Kind#API_ERROR}, otherwise null
     */
    public String getBody() {
        return body;
    }
}
