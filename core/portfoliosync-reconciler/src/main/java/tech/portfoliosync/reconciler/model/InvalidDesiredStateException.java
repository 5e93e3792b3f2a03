package tech.portfoliosync.reconciler.model;

/**
 * Thrown when a desired-state document cannot be read or fails validation.
 */
public class InvalidDesiredStateException extends RuntimeException {

    public InvalidDesiredStateException(String message) {
        super(message);
    }

    public InvalidDesiredStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
