package warden.core.config;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for API key and Basic-auth credentials.
 *
 * <p>Configuration prefix: {@code warden.auth}
 *
 * <h2>Example</h2>
 * <pre>
 * warden.auth.api-key.header=x-api-key
 * warden.auth.api-key.keys=key-one,key-two
 * warden.auth.basic.users.admin=s3cret
 * </pre>
 *
 * <h2>Environment Variables</h2>
 * <pre>
 * WARDEN_AUTH_API_KEY_KEYS=key-one,key-two
 * </pre>
 */
@ConfigMapping(prefix = "warden.auth")
public interface CredentialConfig {

    ApiKey apiKey();

    Basic basic();

    interface ApiKey {

        /**
         * Name of the request header carrying the API key.
         *
         * @return header name (default: x-api-key)
         */
        @WithDefault("x-api-key")
        String header();

        /**
         * Accepted API keys.
         *
         * @return the allow-list, or empty when no key is accepted
         */
        Optional<List<String>> keys();
    }

    interface Basic {

        /**
         * Accepted Basic-auth users, username to password.
         */
        Map<String, String> users();
    }
}
