package tech.portfoliosync.sdk.exception;

/**
 * Exception thrown when the server rejects the API key (401) or the key lacks the
 * permission a read needs (403).
 */
public class AuthenticationException extends DependencyTrackException {

    private AuthenticationException(String message, int statusCode, String method, String endpoint) {
        super(message, statusCode, method, endpoint, null, null);
    }

    public static AuthenticationException unauthorized(String method, String endpoint) {
        return new AuthenticationException("API key rejected for " + method + " " + endpoint, 401, method, endpoint);
    }

    public static AuthenticationException forbidden(String method, String endpoint) {
        return new AuthenticationException("API key lacks permission for " + method + " " + endpoint, 403,
            method, endpoint);
    }
}
