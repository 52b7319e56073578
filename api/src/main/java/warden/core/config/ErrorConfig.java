package warden.core.config;

import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import warden.core.model.error.ErrorVerbosity;

/**
 * Configuration mapping for error disclosure.
 *
 * <p>Configuration prefix: {@code warden.errors}
 *
 * <h2>Example</h2>
 * <pre>
 * warden.errors.verbosity=type-only
 * warden.errors.realm=orders-api
 * </pre>
 */
@ConfigMapping(prefix = "warden.errors")
public interface ErrorConfig {

    /**
     * How much of an authentication error is written to the response.
     *
     * <p>Read once at startup. Never changes status codes or error kinds, only
     * the response body (and, for {@code none}, the status).
     *
     * @return the verbosity (default: message)
     */
    @WithDefault("message")
    ErrorVerbosity verbosity();

    /**
     * Realm advertised in {@code WWW-Authenticate} challenges.
     *
     * <p>When unset the challenge is the bare scheme ({@code Basic} or {@code Bearer}).
     *
     * @return the realm, or empty
     */
    Optional<String> realm();
}
