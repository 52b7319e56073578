package warden.core.service.auth;

/**
 * Thrown when the verification key set cannot be fetched or parsed.
 *
 * <p>Fatal only for the first fetch at startup. Later refresh failures are logged
 * and the previous key set stays in use.
 */
public class KeySetUnavailableException extends RuntimeException {

    public KeySetUnavailableException(String message) {
        super(message);
    }

    public KeySetUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
