package warden.core.service.auth;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.CredentialConfig;
import warden.core.config.JwtConfig;
import warden.core.model.auth.AuthDecision;
import warden.core.model.auth.CredentialScheme;
import warden.core.model.auth.Principal;
import warden.core.model.auth.Principal.ApiKeyPrincipal;
import warden.core.model.auth.Principal.BasicAuthPrincipal;
import warden.core.model.auth.Principal.BearerPrincipal;
import warden.core.model.auth.VerificationPolicy;
import warden.core.model.error.AuthError;
import warden.core.port.out.ApiKeyAllowList;
import warden.core.port.out.AuthMetrics;
import warden.core.port.out.BasicAuthAllowList;

/**
 * Composes extraction, verification and role checks into one decision per request.
 *
 * <p>The pipeline does no parsing or caching of its own. Each step either passes its
 * result on or ends the request with the step's error; the first error wins.
 *
 * <p>Optional variants accept a request that carries no credential at all. A
 * credential that is present but fails any step is still rejected.
 */
@ApplicationScoped
public class AuthorizationPipeline {

    private static final Logger LOG = Logger.getLogger(AuthorizationPipeline.class);

    private final String apiKeyHeader;
    private final boolean bearerEnabled;
    private final VerificationPolicy policy;
    private final RoleAuthorizer roleAuthorizer;
    private final ApiKeyAllowList apiKeys;
    private final BasicAuthAllowList basicUsers;
    private final KeySetCacheService keySetCache;
    private final JwtVerifier jwtVerifier;
    private final AuthMetrics metrics;

    @Inject
    public AuthorizationPipeline(
            CredentialConfig credentialConfig,
            JwtConfig jwtConfig,
            ApiKeyAllowList apiKeys,
            BasicAuthAllowList basicUsers,
            KeySetCacheService keySetCache,
            JwtVerifier jwtVerifier,
            AuthMetrics metrics) {
        this.apiKeyHeader = credentialConfig.apiKey().header();
        this.bearerEnabled = jwtConfig.enabled();
        this.policy = new VerificationPolicy(
                jwtConfig.audiences().orElse(Set.of()),
                jwtConfig.issuers().orElse(Set.of()),
                jwtConfig.validateNotBefore(),
                jwtConfig.clockSkew());
        this.roleAuthorizer = new RoleAuthorizer(jwtConfig.rolesClaim());
        this.apiKeys = apiKeys;
        this.basicUsers = basicUsers;
        this.keySetCache = keySetCache;
        this.jwtVerifier = jwtVerifier;
        this.metrics = metrics;
    }

    /**
     * Authenticate the API key in the configured header against the allow-list.
     */
    public Uni<AuthDecision<Principal>> authenticateApiKey(Map<String, List<String>> headers) {
        var decision = andThen(CredentialExtractor.apiKey(header(headers, apiKeyHeader)), credential -> apiKeys
                .isAllowed(credential.value())
                .map(allowed -> allowed
                        ? AuthDecision.<Principal>accepted(new ApiKeyPrincipal(credential.value()))
                        : AuthDecision.<Principal>rejected(AuthError.invalidCredential(
                                CredentialScheme.API_KEY, "API key is not on the allow-list")))
                .onFailure()
                .recoverWithItem(error -> oracleFailure(CredentialScheme.API_KEY, error)));
        return recorded(CredentialScheme.API_KEY, decision);
    }

    public Uni<AuthDecision<Optional<Principal>>> authenticateApiKeyOptional(Map<String, List<String>> headers) {
        return optional(header(headers, apiKeyHeader), () -> authenticateApiKey(headers));
    }

    /**
     * Authenticate {@code Authorization: Basic} credentials against the user allow-list.
     */
    public Uni<AuthDecision<Principal>> authenticateBasic(Map<String, List<String>> headers) {
        var extracted = CredentialExtractor.basicAuth(header(headers, CredentialExtractor.AUTHORIZATION));
        var decision = andThen(extracted, pair -> basicUsers
                .authenticate(pair.username(), pair.password())
                .map(authenticated -> authenticated
                        ? AuthDecision.<Principal>accepted(new BasicAuthPrincipal(pair.username()))
                        : AuthDecision.<Principal>rejected(AuthError.invalidCredential(
                                CredentialScheme.BASIC, "Username or password not accepted for " + pair.username())))
                .onFailure()
                .recoverWithItem(error -> oracleFailure(CredentialScheme.BASIC, error)));
        return recorded(CredentialScheme.BASIC, decision);
    }

    public Uni<AuthDecision<Optional<Principal>>> authenticateBasicOptional(Map<String, List<String>> headers) {
        return optional(header(headers, CredentialExtractor.AUTHORIZATION), () -> authenticateBasic(headers));
    }

    /**
     * Verify a bearer token and convert its claims to {@code claimsType}.
     */
    public <C> Uni<AuthDecision<Principal>> authenticateBearer(Map<String, List<String>> headers, Class<C> claimsType) {
        return authenticateBearer(headers, claimsType, List.of());
    }

    /**
     * Verify a bearer token and require any one of {@code requiredRoles}.
     *
     * @param requiredRoles roles of which at least one must be granted; empty for none
     */
    public <C> Uni<AuthDecision<Principal>> authenticateBearer(
            Map<String, List<String>> headers, Class<C> claimsType, Collection<String> requiredRoles) {
        if (!bearerEnabled) {
            return recorded(
                    CredentialScheme.BEARER,
                    Uni.createFrom()
                            .item(AuthDecision.<Principal>rejected(AuthError.internal(
                                    CredentialScheme.BEARER, "Bearer token verification is not configured", null))));
        }

        var extracted = CredentialExtractor.bearerToken(header(headers, CredentialExtractor.AUTHORIZATION));
        var decision = andThen(extracted, token -> keySetCache
                .snapshot()
                .map(snapshot -> jwtVerifier
                        .verify(token.value(), snapshot, policy, claimsType)
                        .flatMap(claims -> roleAuthorizer.requireAnyRole(claims, requiredRoles))
                        .<Principal>map(claims -> new BearerPrincipal<>(claims)))
                .onFailure()
                .recoverWithItem(error -> AuthDecision.rejected(AuthError.internal(
                        CredentialScheme.BEARER, "Bearer token could not be verified: " + error.getMessage(), error))));
        return recorded(CredentialScheme.BEARER, decision);
    }

    public <C> Uni<AuthDecision<Optional<Principal>>> authenticateBearerOptional(
            Map<String, List<String>> headers, Class<C> claimsType, Collection<String> requiredRoles) {
        return optional(
                header(headers, CredentialExtractor.AUTHORIZATION),
                () -> authenticateBearer(headers, claimsType, requiredRoles));
    }

    /**
     * First value of a header, matching the name case-insensitively.
     *
     * @return the value, or null when the header is absent
     */
    static String header(Map<String, List<String>> headers, String name) {
        if (headers == null) {
            return null;
        }
        for (var entry : headers.entrySet()) {
            if (entry.getKey() != null
                    && entry.getKey().equalsIgnoreCase(name)
                    && entry.getValue() != null
                    && !entry.getValue().isEmpty()) {
                return entry.getValue().get(0);
            }
        }
        return null;
    }

    private Uni<AuthDecision<Optional<Principal>>> optional(
            String presented, Supplier<Uni<AuthDecision<Principal>>> required) {
        if (presented == null) {
            return Uni.createFrom().item(AuthDecision.<Optional<Principal>>accepted(Optional.empty()));
        }
        return required.get().map(decision -> decision.map(Optional::of));
    }

    private static <T> Uni<AuthDecision<Principal>> andThen(
            AuthDecision<T> decision, Function<T, Uni<AuthDecision<Principal>>> next) {
        if (decision instanceof AuthDecision.Accepted<T> accepted) {
            return next.apply(accepted.value());
        }
        return Uni.createFrom().item(AuthDecision.<Principal>rejected(((AuthDecision.Rejected<T>) decision).error()));
    }

    private static AuthDecision<Principal> oracleFailure(CredentialScheme scheme, Throwable error) {
        return AuthDecision.rejected(
                AuthError.internal(scheme, "Allow-list lookup failed: " + error.getMessage(), error));
    }

    private Uni<AuthDecision<Principal>> recorded(CredentialScheme scheme, Uni<AuthDecision<Principal>> decision) {
        return decision.invoke(result -> {
            if (result instanceof AuthDecision.Accepted<Principal> accepted) {
                LOG.debugv("Accepted {0} credential for {1}", scheme.tagValue(), accepted.value().name());
                metrics.recordAccepted(scheme);
            } else if (result instanceof AuthDecision.Rejected<Principal> rejected) {
                metrics.recordRejected(scheme, rejected.error().kind());
            }
        });
    }
}
