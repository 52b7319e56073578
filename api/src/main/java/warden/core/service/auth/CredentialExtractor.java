package warden.core.service.auth;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;

import warden.core.model.auth.AuthDecision;
import warden.core.model.auth.CredentialScheme;
import warden.core.model.auth.RawCredential.ApiKeyValue;
import warden.core.model.auth.RawCredential.BasicAuthPair;
import warden.core.model.auth.RawCredential.BearerTokenValue;
import warden.core.model.error.AuthError;

/**
 * Parses raw header values into candidate credentials.
 *
 * <p>All methods are pure and total: every input yields either the parsed credential
 * or a classified {@link AuthError}. Nothing is verified here.
 *
 * <p>A header value counts as text when it consists of visible ASCII characters,
 * spaces and horizontal tabs only.
 */
public final class CredentialExtractor {

    public static final String AUTHORIZATION = "Authorization";

    private CredentialExtractor() {
        // Utility class - prevent instantiation
    }

    /**
     * Extract an API key from the value of the configured API key header.
     *
     * @param headerValue the header value, or null when the header is absent
     * @return the key, MISSING_CREDENTIAL or MALFORMED_CREDENTIAL
     */
    public static AuthDecision<ApiKeyValue> apiKey(String headerValue) {
        if (headerValue == null) {
            return AuthDecision.rejected(AuthError.missingCredential(CredentialScheme.API_KEY, "API key header not found"));
        }
        if (!isHeaderText(headerValue)) {
            return AuthDecision.rejected(AuthError.malformedCredential(
                    CredentialScheme.API_KEY, "API key header value contains invalid characters"));
        }

        return AuthDecision.accepted(new ApiKeyValue(headerValue));
    }

    /**
     * Extract a username and optional password from {@code Authorization: Basic ...}.
     *
     * <p>The decoded text is split on the first colon. A value without a colon is a
     * username with an absent password.
     *
     * @param authorization the Authorization header value, or null when absent
     * @return the pair, or MISSING_CREDENTIAL, MALFORMED_CREDENTIAL or DECODE_FAILURE
     */
    public static AuthDecision<BasicAuthPair> basicAuth(String authorization) {
        return schemeParameter(authorization, CredentialScheme.BASIC)
                .flatMap(CredentialExtractor::decodeBase64)
                .map(CredentialExtractor::splitUserPass);
    }

    /**
     * Extract a token from {@code Authorization: Bearer ...}.
     *
     * @param authorization the Authorization header value, or null when absent
     * @return the token, or MISSING_CREDENTIAL or MALFORMED_CREDENTIAL
     */
    public static AuthDecision<BearerTokenValue> bearerToken(String authorization) {
        return schemeParameter(authorization, CredentialScheme.BEARER).map(BearerTokenValue::new);
    }

    private static AuthDecision<String> schemeParameter(String authorization, CredentialScheme scheme) {
        if (authorization == null) {
            return AuthDecision.rejected(AuthError.missingCredential(scheme, "Authorization header not found"));
        }
        if (!isHeaderText(authorization)) {
            return AuthDecision.rejected(
                    AuthError.malformedCredential(scheme, "Authorization header contains invalid characters"));
        }

        int space = authorization.indexOf(' ');
        if (space < 0 || !authorization.substring(0, space).equals(scheme.challenge())) {
            return AuthDecision.rejected(AuthError.malformedCredential(
                    scheme, "Authorization header is not %s".formatted(scheme.challenge())));
        }

        return AuthDecision.accepted(authorization.substring(space + 1));
    }

    private static AuthDecision<String> decodeBase64(String encoded) {
        // The JDK decoder tolerates missing padding.
        if (encoded.length() % 4 != 0) {
            return AuthDecision.rejected(AuthError.decodeFailure(
                    CredentialScheme.BASIC,
                    "Authorization header could not be decoded: length %d is not padded to a multiple of 4"
                            .formatted(encoded.length()),
                    null));
        }

        byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(encoded);
        } catch (IllegalArgumentException e) {
            return AuthDecision.rejected(AuthError.decodeFailure(
                    CredentialScheme.BASIC, "Authorization header could not be decoded: " + e.getMessage(), e));
        }

        try {
            var text = StandardCharsets.UTF_8
                    .newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(decoded))
                    .toString();
            return AuthDecision.accepted(text);
        } catch (CharacterCodingException e) {
            return AuthDecision.rejected(AuthError.decodeFailure(
                    CredentialScheme.BASIC, "Decoded authorization header is not valid UTF-8", e));
        }
    }

    private static BasicAuthPair splitUserPass(String decoded) {
        int colon = decoded.indexOf(':');
        if (colon < 0) {
            return new BasicAuthPair(decoded, Optional.empty());
        }
        return new BasicAuthPair(decoded.substring(0, colon), Optional.of(decoded.substring(colon + 1)));
    }

    static boolean isHeaderText(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c != '\t' && (c < 0x20 || c > 0x7E)) {
                return false;
            }
        }
        return true;
    }
}
