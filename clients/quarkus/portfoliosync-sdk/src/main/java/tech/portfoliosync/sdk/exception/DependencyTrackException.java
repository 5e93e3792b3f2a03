package tech.portfoliosync.sdk.exception;

/**
 * Base exception for Dependency-Track SDK errors.
 *
 * <p>Thrown by every read that does not complete with a success status, and by any call
 * that fails at the transport level. Carries the request that failed and, when the server
 * answered, its status and body.
 */
public class DependencyTrackException extends RuntimeException {

    /** Status used when no response was received */
    public static final int NO_RESPONSE = 0;

    private final int statusCode;
    private final String method;
    private final String endpoint;
    private final String responseBody;

    public DependencyTrackException(String message, int statusCode) {
        this(message, statusCode, null, null, null, null);
    }

    protected DependencyTrackException(String message, int statusCode, String method, String endpoint,
                                       String responseBody, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.method = method;
        this.endpoint = endpoint;
        this.responseBody = responseBody;
    }

    /**
     * A read answered with a status outside 2xx.
     */
    public static DependencyTrackException readFailed(String method, String endpoint, int status, String body) {
        return new DependencyTrackException(method + " " + endpoint + " failed with status " + status,
            status, method, endpoint, body, null);
    }

    /**
     * The server could not be reached or the call was interrupted.
     */
    public static DependencyTrackException transportFailed(String method, String endpoint, Throwable cause) {
        return new DependencyTrackException("Request failed: " + method + " " + endpoint + ": " + cause.getMessage(),
            NO_RESPONSE, method, endpoint, null, cause);
    }

    /**
     * A 2xx response whose body does not match the expected type.
     */
    public static DependencyTrackException unreadableResponse(String method, String endpoint, int status,
                                                              Throwable cause) {
        return new DependencyTrackException("Failed to parse response of " + method + " " + endpoint,
            status, method, endpoint, null, cause);
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean hasResponse() {
        return statusCode != NO_RESPONSE;
    }

    public String getMethod() {
        return method;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
