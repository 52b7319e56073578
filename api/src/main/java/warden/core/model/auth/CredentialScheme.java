package warden.core.model.auth;

import java.util.Locale;

/**
 * Credential schemes understood by the authorization pipeline.
 */
public enum CredentialScheme {
    API_KEY(null),
    BASIC("Basic"),
    BEARER("Bearer");

    private final String challenge;

    CredentialScheme(String challenge) {
        this.challenge = challenge;
    }

    /**
     * Scheme token used in the {@code Authorization} and {@code WWW-Authenticate} headers.
     *
     * @return the scheme token, or null for header-based API keys
     */
    public String challenge() {
        return challenge;
    }

    public String tagValue() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
