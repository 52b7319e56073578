package warden.core.service.auth;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jwa.AlgorithmConstraints.ConstraintType;
import org.jose4j.jwk.JsonWebKey;
import org.jose4j.jwk.RsaJsonWebKey;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwx.HeaderParameterNames;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.consumer.ErrorCodeValidator;
import org.jose4j.jwt.consumer.ErrorCodes;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.lang.JoseException;

import warden.core.model.auth.AuthDecision;
import warden.core.model.auth.CredentialScheme;
import warden.core.model.auth.KeySetSnapshot;
import warden.core.model.auth.ValidatedClaims;
import warden.core.model.auth.VerificationPolicy;
import warden.core.model.error.AuthError;

/**
 * Verifies compact JWS bearer tokens against a key set snapshot.
 *
 * <p>Steps, stopping at the first failure:
 * <ol>
 *   <li>read the {@code kid} from the unverified header; a token without one is invalid</li>
 *   <li>look the key up in the snapshot</li>
 *   <li>accept RSA keys only</li>
 *   <li>take the signing algorithm from the key's {@code alg}; only that algorithm is permitted</li>
 *   <li>verify signature, {@code exp}, {@code aud}, {@code iss} and optionally {@code nbf}</li>
 *   <li>convert the claims to the caller's type</li>
 * </ol>
 *
 * <p>An expired token is reported as {@code TOKEN_EXPIRED}, every other verification
 * failure as {@code TOKEN_INVALID}. Failing to convert verified claims is an internal error.
 */
@ApplicationScoped
public class JwtVerifier {

    private static final Logger LOG = Logger.getLogger(JwtVerifier.class);

    private static final String RSA_KEY_TYPE = "RSA";

    private final ObjectMapper objectMapper;

    @Inject
    public JwtVerifier(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Verify a token and convert its claims.
     *
     * @param token      the compact serialization
     * @param snapshot   the key set to verify against
     * @param policy     expected audiences, issuers and time checks
     * @param claimsType caller-defined claims shape
     * @return the verified claims or the classified failure
     */
    public <C> AuthDecision<ValidatedClaims<C>> verify(
            String token, KeySetSnapshot snapshot, VerificationPolicy policy, Class<C> claimsType) {
        return keyId(token)
                .flatMap(kid -> lookupKey(snapshot, kid))
                .flatMap(this::requireRsa)
                .flatMap(key -> verifyClaims(token, key, policy))
                .flatMap(claims -> convert(claims, claimsType));
    }

    private AuthDecision<String> keyId(String token) {
        Object kid;
        try {
            var jws = new JsonWebSignature();
            jws.setCompactSerialization(token);
            kid = jws.getHeaders().getObjectHeaderValue(HeaderParameterNames.KEY_ID);
        } catch (JoseException e) {
            return AuthDecision.rejected(AuthError.tokenInvalid("Token header could not be parsed: " + e.getMessage(), e));
        }

        if (kid == null) {
            return AuthDecision.rejected(AuthError.tokenInvalid("Token header has no key id (kid)"));
        }
        // kid may hold any JSON value.
        if (!(kid instanceof String keyId)) {
            return AuthDecision.rejected(AuthError.tokenInvalid(
                    "Token header key id (kid) is a %s, not a string".formatted(kid.getClass().getSimpleName())));
        }
        if (keyId.isBlank()) {
            return AuthDecision.rejected(AuthError.tokenInvalid("Token header has no key id (kid)"));
        }
        return AuthDecision.accepted(keyId);
    }

    private AuthDecision<JsonWebKey> lookupKey(KeySetSnapshot snapshot, String kid) {
        return snapshot.find(kid)
                .map(AuthDecision::accepted)
                .orElseGet(() -> AuthDecision.rejected(
                        AuthError.tokenInvalid("No key with id '%s' in the current key set".formatted(kid))));
    }

    private AuthDecision<RsaJsonWebKey> requireRsa(JsonWebKey key) {
        if (key instanceof RsaJsonWebKey rsa && RSA_KEY_TYPE.equals(key.getKeyType())) {
            return AuthDecision.accepted(rsa);
        }
        return AuthDecision.rejected(AuthError.tokenInvalid(
                "Key '%s' has unsupported key type %s".formatted(key.getKeyId(), key.getKeyType())));
    }

    private AuthDecision<JwtClaims> verifyClaims(String token, RsaJsonWebKey key, VerificationPolicy policy) {
        var algorithm = signingAlgorithm(key);
        if (algorithm.isEmpty()) {
            return AuthDecision.rejected(AuthError.tokenInvalid(
                    "Key '%s' declares unsupported algorithm %s".formatted(key.getKeyId(), key.getAlgorithm())));
        }

        var builder = new JwtConsumerBuilder()
                .setRequireExpirationTime()
                .setAllowedClockSkewInSeconds((int) policy.clockSkew().toSeconds())
                .setVerificationKey(key.getRsaPublicKey())
                .setJwsAlgorithmConstraints(new AlgorithmConstraints(ConstraintType.PERMIT, algorithm.get()));

        if (policy.audiences().isEmpty()) {
            builder.setSkipDefaultAudienceValidation();
        } else {
            builder.setExpectedAudience(policy.audiences().toArray(new String[0]));
        }
        if (!policy.issuers().isEmpty()) {
            builder.setExpectedIssuers(true, policy.issuers().toArray(new String[0]));
        }

        try {
            return AuthDecision.accepted(builder.build().processToClaims(token));
        } catch (InvalidJwtException e) {
            return classify(e, policy);
        } catch (ClassCastException e) {
            return AuthDecision.rejected(AuthError.tokenInvalid("Token header has a non-string value: " + e.getMessage(), e));
        }
    }

    private AuthDecision<JwtClaims> classify(InvalidJwtException e, VerificationPolicy policy) {
        if (e.hasExpired()) {
            return AuthDecision.rejected(AuthError.tokenExpired(describe(e)));
        }
        if (!policy.validateNotBefore() && onlyNotYetValid(e) && e.getJwtContext() != null) {
            LOG.debug("Accepting token before its nbf, not-before validation is disabled");
            return AuthDecision.accepted(e.getJwtContext().getJwtClaims());
        }
        return AuthDecision.rejected(AuthError.tokenInvalid(describe(e), e));
    }

    private boolean onlyNotYetValid(InvalidJwtException e) {
        var details = e.getErrorDetails();
        return !details.isEmpty()
                && details.stream().allMatch(error -> error.getErrorCode() == ErrorCodes.NOT_YET_VALID);
    }

    private String describe(InvalidJwtException e) {
        var details = e.getErrorDetails();
        if (details == null || details.isEmpty()) {
            return e.getMessage();
        }
        return details.stream().map(ErrorCodeValidator.Error::getErrorMessage).collect(Collectors.joining("; "));
    }

    private <C> AuthDecision<ValidatedClaims<C>> convert(JwtClaims claims, Class<C> claimsType) {
        try {
            Map<String, Object> raw = claims.getClaimsMap();
            C converted = objectMapper.convertValue(raw, claimsType);
            var expiresAt = claims.getExpirationTime() == null
                    ? null
                    : Instant.ofEpochSecond(claims.getExpirationTime().getValue());
            return AuthDecision.accepted(new ValidatedClaims<>(
                    converted, claims.getSubject(), claims.getIssuer(), claims.getAudience(), expiresAt, raw));
        } catch (IllegalArgumentException | MalformedClaimException e) {
            return AuthDecision.rejected(AuthError.internal(
                    CredentialScheme.BEARER,
                    "Verified claims could not be converted to %s: %s".formatted(claimsType.getSimpleName(), e.getMessage()),
                    e));
        }
    }

    static Optional<String> signingAlgorithm(JsonWebKey key) {
        var alg = key.getAlgorithm();
        if (alg == null) {
            return Optional.empty();
        }
        switch (alg) {
            case AlgorithmIdentifiers.RSA_USING_SHA256:
            case AlgorithmIdentifiers.RSA_USING_SHA384:
            case AlgorithmIdentifiers.RSA_USING_SHA512:
            case AlgorithmIdentifiers.RSA_PSS_USING_SHA256:
            case AlgorithmIdentifiers.RSA_PSS_USING_SHA384:
            case AlgorithmIdentifiers.RSA_PSS_USING_SHA512:
                return Optional.of(alg);
            default:
                return Optional.empty();
        }
    }
}
