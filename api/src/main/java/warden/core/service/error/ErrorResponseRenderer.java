package warden.core.service.error;

import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import warden.core.config.ErrorConfig;
import warden.core.model.auth.CredentialScheme;
import warden.core.model.error.AuthError;
import warden.core.model.error.ErrorBody;
import warden.core.model.error.ErrorResponse;
import warden.core.model.error.ErrorVerbosity;

/**
 * Shapes an {@link AuthError} into a response according to {@link ErrorVerbosity}.
 *
 * <p>This is the only place where verbosity is consulted. Business logic produces
 * complete errors and never branches on the disclosure level.
 *
 * <ul>
 *   <li>{@code NONE} - 204, no headers, no body</li>
 *   <li>{@code STATUS_ONLY} - status and challenge, no body</li>
 *   <li>{@code MESSAGE} - {@code {"message"}}</li>
 *   <li>{@code TYPE_ONLY} - {@code {"kind", "message"}}</li>
 *   <li>{@code FULL} - {@code {"kind", "message", "detail"}}</li>
 * </ul>
 */
@ApplicationScoped
public class ErrorResponseRenderer {

    public static final String WWW_AUTHENTICATE = "WWW-Authenticate";

    private final ErrorVerbosity verbosity;
    private final String realm;

    @Inject
    public ErrorResponseRenderer(ErrorConfig config) {
        this(config.verbosity(), config.realm().orElse(null));
    }

    public ErrorResponseRenderer(ErrorVerbosity verbosity, String realm) {
        this.verbosity = verbosity == null ? ErrorVerbosity.MESSAGE : verbosity;
        this.realm = realm;
    }

    public ErrorVerbosity verbosity() {
        return verbosity;
    }

    /**
     * Render with the configured verbosity.
     */
    public ErrorResponse render(AuthError error) {
        return render(error, verbosity);
    }

    /**
     * Render with an explicit verbosity.
     *
     * @param error     the error to render
     * @param verbosity the disclosure level
     * @return the response description, never null
     */
    public ErrorResponse render(AuthError error, ErrorVerbosity verbosity) {
        if (verbosity == ErrorVerbosity.NONE) {
            return ErrorResponse.noContent();
        }

        return new ErrorResponse(error.statusCode(), challengeHeaders(error), body(error, verbosity));
    }

    private Optional<ErrorBody> body(AuthError error, ErrorVerbosity verbosity) {
        if (!verbosity.includesBody()) {
            return Optional.empty();
        }
        if (!verbosity.includesKind()) {
            return Optional.of(ErrorBody.message(error.summary()));
        }

        var detail = verbosity.includesDetail() ? error.detail().orElse(null) : null;
        return Optional.of(new ErrorBody(error.kind().wireName(), error.summary(), detail));
    }

    private Map<String, String> challengeHeaders(AuthError error) {
        if (error.statusCode() != 401) {
            return Map.of();
        }

        return error.scheme()
                .map(CredentialScheme::challenge)
                .map(challenge -> Map.of(WWW_AUTHENTICATE, challenge(challenge)))
                .orElse(Map.of());
    }

    private String challenge(String scheme) {
        if (realm == null || realm.isBlank()) {
            return scheme;
        }
        return "%s realm=\"%s\"".formatted(scheme, realm);
    }
}
