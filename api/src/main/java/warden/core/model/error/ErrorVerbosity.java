package warden.core.model.error;

/**
 * How much of an {@link AuthError} is disclosed to the client.
 *
 * <p>Verbosity only shapes the serialized response. The status code and the
 * error kind of a failure are the same at every level, except for {@link #NONE}
 * which replaces the status with {@code 204 No Content}.
 *
 * <p>Configuration: {@code warden.errors.verbosity}
 */
public enum ErrorVerbosity {

    /**
     * Empty {@code 204 No Content} for every error.
     *
     * <p>Hides from the client that an error occurred at all. Operators still see
     * every failure in the logs.
     */
    NONE,

    /**
     * Status code and challenge header, empty body.
     */
    STATUS_ONLY,

    /**
     * Status code plus the fixed summary message of the error kind.
     */
    MESSAGE,

    /**
     * Status code plus error kind and summary message, detail omitted.
     */
    TYPE_ONLY,

    /**
     * Status code, error kind, summary message and the underlying detail.
     */
    FULL;

    /**
     * Check whether a response body is written at this level.
     *
     * @return true for MESSAGE, TYPE_ONLY and FULL
     */
    public boolean includesBody() {
        return this == MESSAGE || this == TYPE_ONLY || this == FULL;
    }

    /**
     * Check whether the error kind is written at this level.
     *
     * @return true for TYPE_ONLY and FULL
     */
    public boolean includesKind() {
        return this == TYPE_ONLY || this == FULL;
    }

    /**
     * Check whether the error detail is written at this level.
     *
     * @return true only for FULL
     */
    public boolean includesDetail() {
        return this == FULL;
    }
}
