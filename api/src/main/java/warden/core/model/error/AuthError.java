package warden.core.model.error;

import java.util.Objects;
import java.util.Optional;

import org.jboss.logging.Logger;

import warden.core.model.auth.CredentialScheme;

/**
 * A classified authentication failure.
 *
 * <p>Instances are created only through the static factories. Every factory call
 * writes one diagnostic log record, whatever the configured {@link ErrorVerbosity}:
 * credential rejections at WARN, internal failures at ERROR with the cause attached.
 *
 * <p>The detail text is kept for {@link ErrorVerbosity#FULL} rendering. It must never
 * contain the presented secret.
 */
public final class AuthError {

    private static final Logger LOG = Logger.getLogger(AuthError.class);

    private final AuthErrorKind kind;
    private final CredentialScheme scheme;
    private final String detail;
    private final Throwable cause;

    private AuthError(AuthErrorKind kind, CredentialScheme scheme, String detail, Throwable cause) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.scheme = scheme;
        this.detail = detail;
        this.cause = cause;
    }

    public static AuthError missingCredential(CredentialScheme scheme, String detail) {
        return create(AuthErrorKind.MISSING_CREDENTIAL, scheme, detail, null);
    }

    public static AuthError malformedCredential(CredentialScheme scheme, String detail) {
        return create(AuthErrorKind.MALFORMED_CREDENTIAL, scheme, detail, null);
    }

    public static AuthError decodeFailure(CredentialScheme scheme, String detail, Throwable cause) {
        return create(AuthErrorKind.DECODE_FAILURE, scheme, detail, cause);
    }

    public static AuthError invalidCredential(CredentialScheme scheme, String detail) {
        return create(AuthErrorKind.INVALID_CREDENTIAL, scheme, detail, null);
    }

    public static AuthError tokenExpired(String detail) {
        return create(AuthErrorKind.TOKEN_EXPIRED, CredentialScheme.BEARER, detail, null);
    }

    public static AuthError tokenInvalid(String detail) {
        return create(AuthErrorKind.TOKEN_INVALID, CredentialScheme.BEARER, detail, null);
    }

    public static AuthError tokenInvalid(String detail, Throwable cause) {
        return create(AuthErrorKind.TOKEN_INVALID, CredentialScheme.BEARER, detail, cause);
    }

    public static AuthError insufficientRole(String detail) {
        return create(AuthErrorKind.INSUFFICIENT_ROLE, CredentialScheme.BEARER, detail, null);
    }

    public static AuthError internal(CredentialScheme scheme, String detail, Throwable cause) {
        return create(AuthErrorKind.INTERNAL, scheme, detail, cause);
    }

    private static AuthError create(AuthErrorKind kind, CredentialScheme scheme, String detail, Throwable cause) {
        var error = new AuthError(kind, scheme, detail, cause);
        error.log();
        return error;
    }

    private void log() {
        var schemeTag = scheme == null ? "-" : scheme.tagValue();
        if (kind == AuthErrorKind.INTERNAL) {
            LOG.logv(kind.logLevel(), cause, "Authentication failed internally [scheme={0}]: {1}", schemeTag, detail);
        } else if (cause != null) {
            LOG.logv(
                    kind.logLevel(),
                    "Rejected credential [kind={0}, scheme={1}]: {2} ({3})",
                    kind.wireName(),
                    schemeTag,
                    detail,
                    cause.getMessage());
        } else {
            LOG.logv(
                    kind.logLevel(), "Rejected credential [kind={0}, scheme={1}]: {2}", kind.wireName(), schemeTag, detail);
        }
    }

    public AuthErrorKind kind() {
        return kind;
    }

    public int statusCode() {
        return kind.statusCode();
    }

    public String summary() {
        return kind.summary();
    }

    public Optional<CredentialScheme> scheme() {
        return Optional.ofNullable(scheme);
    }

    public Optional<String> detail() {
        return Optional.ofNullable(detail);
    }

    public Optional<Throwable> cause() {
        return Optional.ofNullable(cause);
    }

    @Override
    public String toString() {
        return "AuthError[kind=" + kind + ", scheme=" + scheme + ", detail=" + detail + "]";
    }
}
