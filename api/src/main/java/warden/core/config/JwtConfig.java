package warden.core.config;

import java.net.URI;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for bearer token verification.
 *
 * <p>Configuration prefix: {@code warden.jwt}
 *
 * <p>Exactly one of {@code jwks-uri} or {@code discovery-uri} should be set when
 * verification is enabled. With a discovery URI the key set location is read from
 * the {@code jwks_uri} field of the OpenID Connect discovery document.
 *
 * <h2>Example</h2>
 * <pre>
 * warden.jwt.enabled=true
 * warden.jwt.jwks-uri=https://idp.example.com/realms/main/protocol/openid-connect/certs
 * warden.jwt.issuers=https://idp.example.com/realms/main
 * warden.jwt.audiences=account,orders-api
 * warden.jwt.ttl=PT5M
 * </pre>
 */
@ConfigMapping(prefix = "warden.jwt")
public interface JwtConfig {

    /**
     * Enable bearer token verification.
     *
     * <p>When enabled the key set is fetched at startup and startup fails if the
     * fetch fails.
     *
     * @return true if enabled (default: false)
     */
    @WithDefault("false")
    boolean enabled();

    /**
     * Location of the published key set.
     */
    Optional<URI> jwksUri();

    /**
     * Location of an OpenID Connect discovery document.
     */
    Optional<URI> discoveryUri();

    /**
     * Maximum age of the cached key set before a read triggers a refresh.
     *
     * @return TTL (default: 5 minutes)
     */
    @WithDefault("PT5M")
    Duration ttl();

    /**
     * Maximum time to wait for the key set endpoint.
     *
     * @return fetch timeout (default: 5 seconds)
     */
    @WithDefault("PT5S")
    Duration fetchTimeout();

    /**
     * Accepted {@code aud} values. A token is accepted when any of its audiences
     * is listed. Empty disables the audience check.
     */
    Optional<Set<String>> audiences();

    /**
     * Accepted {@code iss} values. Empty disables the issuer check.
     */
    Optional<Set<String>> issuers();

    /**
     * Reject tokens whose {@code nbf} lies in the future.
     *
     * @return true to check not-before (default: true)
     */
    @WithDefault("true")
    boolean validateNotBefore();

    /**
     * Tolerance for {@code exp} and {@code nbf}.
     *
     * @return clock skew (default: 30 seconds)
     */
    @WithDefault("PT30S")
    Duration clockSkew();

    /**
     * Claim holding the roles used by role checks. Dotted paths address nested
     * objects, e.g. {@code realm_access.roles}.
     *
     * @return the roles claim (default: roles)
     */
    @WithDefault("roles")
    String rolesClaim();
}
