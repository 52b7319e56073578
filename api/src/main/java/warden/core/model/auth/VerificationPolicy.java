package warden.core.model.auth;

import java.time.Duration;
import java.util.Set;

/**
 * Claim checks applied to every bearer token.
 *
 * @param audiences         accepted {@code aud} values; empty skips the audience check
 * @param issuers           accepted {@code iss} values; empty skips the issuer check
 * @param validateNotBefore whether a future {@code nbf} rejects the token
 * @param clockSkew         tolerance applied to time-based claims
 */
public record VerificationPolicy(
        Set<String> audiences, Set<String> issuers, boolean validateNotBefore, Duration clockSkew) {

    public VerificationPolicy {
        audiences = audiences == null ? Set.of() : Set.copyOf(audiences);
        issuers = issuers == null ? Set.of() : Set.copyOf(issuers);
        if (clockSkew == null || clockSkew.isNegative()) {
            clockSkew = Duration.ZERO;
        }
    }
}
