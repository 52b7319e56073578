package warden.core.model.auth;

import java.util.Objects;
import java.util.Optional;

/**
 * A credential parsed from request headers but not yet verified.
 */
public sealed interface RawCredential {

    CredentialScheme scheme();

    /**
     * Value of the configured API key header.
     *
     * @param value the presented key
     */
    record ApiKeyValue(String value) implements RawCredential {
        public ApiKeyValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public CredentialScheme scheme() {
            return CredentialScheme.API_KEY;
        }

        @Override
        public String toString() {
            return "ApiKeyValue[value=" + Masking.mask(value) + "]";
        }
    }

    /**
     * Username and optional password decoded from {@code Authorization: Basic}.
     *
     * @param username text before the first colon, or the whole value when there is none
     * @param password text after the first colon; empty when the value had no colon
     */
    record BasicAuthPair(String username, Optional<String> password) implements RawCredential {
        public BasicAuthPair {
            Objects.requireNonNull(username, "username");
            if (password == null) {
                password = Optional.empty();
            }
        }

        @Override
        public CredentialScheme scheme() {
            return CredentialScheme.BASIC;
        }

        @Override
        public String toString() {
            return "BasicAuthPair[username=" + username + ", password=" + password.map(p -> "****").orElse("<absent>")
                    + "]";
        }
    }

    /**
     * Token carried by {@code Authorization: Bearer}.
     *
     * @param value the compact token
     */
    record BearerTokenValue(String value) implements RawCredential {
        public BearerTokenValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public CredentialScheme scheme() {
            return CredentialScheme.BEARER;
        }

        @Override
        public String toString() {
            return "BearerTokenValue[value=" + Masking.mask(value) + "]";
        }
    }
}
