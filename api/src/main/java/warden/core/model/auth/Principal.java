package warden.core.model.auth;

import java.util.Objects;

/**
 * The credential accepted for a request, in verified form.
 */
public sealed interface Principal {

    CredentialScheme scheme();

    /**
     * Name safe to log and to show downstream handlers.
     */
    String name();

    /**
     * An API key that is on the allow-list.
     *
     * @param key the accepted key
     */
    record ApiKeyPrincipal(String key) implements Principal {
        public ApiKeyPrincipal {
            Objects.requireNonNull(key, "key");
        }

        @Override
        public CredentialScheme scheme() {
            return CredentialScheme.API_KEY;
        }

        @Override
        public String name() {
            return Masking.mask(key);
        }

        @Override
        public String toString() {
            return "ApiKeyPrincipal[key=" + Masking.mask(key) + "]";
        }
    }

    /**
     * A Basic-auth user whose password was accepted.
     *
     * @param username the authenticated user
     */
    record BasicAuthPrincipal(String username) implements Principal {
        public BasicAuthPrincipal {
            Objects.requireNonNull(username, "username");
        }

        @Override
        public CredentialScheme scheme() {
            return CredentialScheme.BASIC;
        }

        @Override
        public String name() {
            return username;
        }
    }

    /**
     * A verified bearer token.
     *
     * @param claims the verified claims
     * @param <C>    caller-defined claims type
     */
    record BearerPrincipal<C>(ValidatedClaims<C> claims) implements Principal {
        public BearerPrincipal {
            Objects.requireNonNull(claims, "claims");
        }

        @Override
        public CredentialScheme scheme() {
            return CredentialScheme.BEARER;
        }

        @Override
        public String name() {
            return claims.subject() == null ? "anonymous" : claims.subject();
        }
    }
}
