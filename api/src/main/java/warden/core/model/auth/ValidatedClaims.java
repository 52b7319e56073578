package warden.core.model.auth;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Claims of a bearer token that passed signature and claim verification.
 *
 * <p>Produced per request by the JWT verifier and never cached.
 *
 * @param claims    claims deserialized into the caller's shape
 * @param subject   the {@code sub} claim, may be null
 * @param issuer    the {@code iss} claim, may be null
 * @param audiences the {@code aud} claim values
 * @param expiresAt the {@code exp} claim
 * @param raw       all claims as parsed from the token
 * @param <C>       caller-defined claims type
 */
public record ValidatedClaims<C>(
        C claims, String subject, String issuer, List<String> audiences, Instant expiresAt, Map<String, Object> raw) {

    public ValidatedClaims {
        Objects.requireNonNull(claims, "claims");
        audiences = audiences == null ? List.of() : List.copyOf(audiences);
        raw = raw == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(raw));
    }
}
