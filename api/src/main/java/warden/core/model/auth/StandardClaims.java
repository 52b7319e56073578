package warden.core.model.auth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Default claims shape, modelled on an OpenID Connect ID token.
 *
 * <p>Any claim not listed here is ignored. Missing claims are null.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StandardClaims(
        @JsonProperty("sub") String subject,
        @JsonProperty("iss") String issuer,
        @JsonProperty("email") String email,
        @JsonProperty("email_verified") Boolean emailVerified,
        @JsonProperty("name") String name,
        @JsonProperty("preferred_username") String preferredUsername,
        @JsonProperty("given_name") String givenName,
        @JsonProperty("family_name") String familyName) {}
