package warden.adapter.in.auth;

import java.util.Optional;

import jakarta.ws.rs.container.ContainerRequestContext;

import warden.core.model.auth.Principal;
import warden.core.model.auth.Principal.BearerPrincipal;

/**
 * Access to the principal the credential filter stored on the request.
 */
public final class RequestPrincipal {

    public static final String PROPERTY = "warden.auth.principal";

    private RequestPrincipal() {}

    public static Optional<Principal> from(ContainerRequestContext request) {
        var value = request.getProperty(PROPERTY);
        if (value instanceof Principal principal) {
            return Optional.of(principal);
        }
        return Optional.empty();
    }

    /**
     * The stored principal.
     *
     * @throws IllegalStateException if the resource is not protected or the credential was optional and absent
     */
    public static Principal require(ContainerRequestContext request) {
        return from(request).orElseThrow(() -> new IllegalStateException("No authenticated principal on request"));
    }

    /**
     * Claims of a verified bearer token, converted to {@code claimsType}.
     */
    public static <C> Optional<C> claims(ContainerRequestContext request, Class<C> claimsType) {
        return from(request)
                .filter(BearerPrincipal.class::isInstance)
                .map(principal -> ((BearerPrincipal<?>) principal).claims().claims())
                .filter(claimsType::isInstance)
                .map(claimsType::cast);
    }

    public static void store(ContainerRequestContext request, Principal principal) {
        request.setProperty(PROPERTY, principal);
    }
}
