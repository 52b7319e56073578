package warden.core.model.error;

import java.util.Locale;

import org.jboss.logging.Logger.Level;

/**
 * Closed set of authentication failure kinds.
 *
 * <p>Status code, summary message and log level are fixed per kind.
 */
public enum AuthErrorKind {
    MISSING_CREDENTIAL(401, "Credentials are missing", Level.WARN),
    MALFORMED_CREDENTIAL(401, "Credentials are malformed", Level.WARN),
    DECODE_FAILURE(401, "Credentials could not be decoded", Level.WARN),
    INVALID_CREDENTIAL(403, "Credentials are invalid", Level.WARN),
    TOKEN_EXPIRED(401, "Token has expired", Level.WARN),
    TOKEN_INVALID(401, "Token is invalid", Level.WARN),
    INSUFFICIENT_ROLE(403, "Insufficient role", Level.WARN),
    INTERNAL(500, "An internal server error has occurred", Level.ERROR);

    private final int statusCode;
    private final String summary;
    private final Level logLevel;

    AuthErrorKind(int statusCode, String summary, Level logLevel) {
        this.statusCode = statusCode;
        this.summary = summary;
        this.logLevel = logLevel;
    }

    public int statusCode() {
        return statusCode;
    }

    public String summary() {
        return summary;
    }

    public Level logLevel() {
        return logLevel;
    }

    /**
     * Name used on the wire, e.g. {@code token_expired}.
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Whether the failure is caused by the presented credential rather than by
     * the server.
     */
    public boolean isCredentialRejection() {
        return this != INTERNAL;
    }
}
