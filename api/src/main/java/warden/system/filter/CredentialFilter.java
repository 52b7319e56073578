package warden.system.filter;

import java.lang.reflect.AnnotatedElement;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ResourceInfo;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerRequestFilter;

import warden.adapter.in.auth.RequestPrincipal;
import warden.adapter.in.auth.RequireApiKey;
import warden.adapter.in.auth.RequireBasicAuth;
import warden.adapter.in.auth.RequireBearerToken;
import warden.adapter.in.problem.AuthErrorResponses;
import warden.core.model.auth.AuthDecision;
import warden.core.model.auth.Principal;
import warden.core.model.error.AuthError;
import warden.core.service.auth.AuthorizationPipeline;
import warden.core.service.error.ErrorResponseRenderer;

/**
 * Reactive filter that authenticates requests to annotated resources.
 *
 * <p>A method-level annotation takes precedence over one on the resource class. When
 * an element carries more than one, {@link RequireBearerToken} is applied before
 * {@link RequireBasicAuth}, which is applied before {@link RequireApiKey}.
 *
 * <p>On success the principal is stored as request property
 * {@value RequestPrincipal#PROPERTY}; on failure the request is aborted with the
 * error rendered at the configured verbosity. Resources without an annotation pass
 * through untouched.
 */
public class CredentialFilter {

    private static final Logger LOG = Logger.getLogger(CredentialFilter.class);

    private final AuthorizationPipeline pipeline;
    private final ErrorResponseRenderer renderer;

    @Inject
    public CredentialFilter(AuthorizationPipeline pipeline, ErrorResponseRenderer renderer) {
        this.pipeline = pipeline;
        this.renderer = renderer;
    }

    /**
     * Reactive filter method for credential checks.
     *
     * @param requestContext the request context
     * @param resourceInfo   the matched resource
     * @return Uni with null to continue, or Response to abort
     */
    @ServerRequestFilter(priority = Priorities.AUTHENTICATION)
    public Uni<Response> filter(ContainerRequestContext requestContext, ResourceInfo resourceInfo) {
        var headers = requestContext.getHeaders();
        var decision = authenticate(resourceInfo, headers);
        if (decision == null) {
            return Uni.createFrom().nullItem();
        }

        return decision.onFailure()
                .recoverWithItem(error -> AuthDecision.rejected(
                        AuthError.internal(null, "Unexpected authentication failure: " + error.getMessage(), error)))
                .map(result -> apply(requestContext, result));
    }

    private Uni<AuthDecision<Optional<Principal>>> authenticate(
            ResourceInfo resourceInfo, Map<String, List<String>> headers) {
        var method = resourceInfo == null ? null : resourceInfo.getResourceMethod();
        var decision = method == null ? null : authenticate(method, headers);
        if (decision != null) {
            return decision;
        }
        var resourceClass = resourceInfo == null ? null : resourceInfo.getResourceClass();
        return resourceClass == null ? null : authenticate(resourceClass, headers);
    }

    private Uni<AuthDecision<Optional<Principal>>> authenticate(
            AnnotatedElement element, Map<String, List<String>> headers) {
        var bearer = element.getAnnotation(RequireBearerToken.class);
        if (bearer != null) {
            var roles = List.of(bearer.roles());
            return bearer.optional()
                    ? pipeline.authenticateBearerOptional(headers, bearer.claims(), roles)
                    : required(pipeline.authenticateBearer(headers, bearer.claims(), roles));
        }

        var basic = element.getAnnotation(RequireBasicAuth.class);
        if (basic != null) {
            return basic.optional()
                    ? pipeline.authenticateBasicOptional(headers)
                    : required(pipeline.authenticateBasic(headers));
        }

        var apiKey = element.getAnnotation(RequireApiKey.class);
        if (apiKey != null) {
            return apiKey.optional()
                    ? pipeline.authenticateApiKeyOptional(headers)
                    : required(pipeline.authenticateApiKey(headers));
        }

        return null;
    }

    private static Uni<AuthDecision<Optional<Principal>>> required(Uni<AuthDecision<Principal>> decision) {
        return decision.map(result -> result.map(Optional::of));
    }

    private Response apply(ContainerRequestContext requestContext, AuthDecision<Optional<Principal>> decision) {
        if (decision instanceof AuthDecision.Accepted<Optional<Principal>> accepted) {
            accepted.value().ifPresent(principal -> {
                LOG.debugv("Authenticated {0} principal {1}", principal.scheme().tagValue(), principal.name());
                RequestPrincipal.store(requestContext, principal);
            });
            return null;
        }

        var error = ((AuthDecision.Rejected<Optional<Principal>>) decision).error();
        return AuthErrorResponses.toResponse(renderer.render(error));
    }
}
