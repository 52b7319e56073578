package warden.core.service.auth;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import warden.core.model.auth.AuthDecision;
import warden.core.model.auth.ValidatedClaims;
import warden.core.model.error.AuthError;

/**
 * Checks verified bearer claims for required roles.
 *
 * <p>Roles are read from a configurable claim. Dotted names address nested objects,
 * so {@code realm_access.roles} reads {@code {"realm_access": {"roles": [...]}}}.
 * The claim may hold a JSON array or a space-separated string.
 */
public final class RoleAuthorizer {

    private final List<String> claimPath;
    private final String claimName;

    public RoleAuthorizer(String rolesClaim) {
        if (rolesClaim == null || rolesClaim.isBlank()) {
            throw new IllegalArgumentException("roles claim must not be blank");
        }
        this.claimName = rolesClaim;
        this.claimPath = List.of(rolesClaim.split("\\."));
    }

    /**
     * Require at least one of {@code requiredRoles}. An empty requirement always passes.
     *
     * @return the claims unchanged, or INSUFFICIENT_ROLE
     */
    public <C> AuthDecision<ValidatedClaims<C>> requireAnyRole(ValidatedClaims<C> claims, Collection<String> requiredRoles) {
        if (requiredRoles == null || requiredRoles.isEmpty()) {
            return AuthDecision.accepted(claims);
        }

        var granted = roles(claims);
        for (String role : requiredRoles) {
            if (granted.contains(role)) {
                return AuthDecision.accepted(claims);
            }
        }

        return AuthDecision.rejected(AuthError.insufficientRole(
                "Subject %s has none of the required roles %s in claim '%s'"
                        .formatted(claims.subject(), requiredRoles, claimName)));
    }

    /**
     * Roles present in the configured claim; empty when the claim is absent or not
     * a list or string.
     */
    public Set<String> roles(ValidatedClaims<?> claims) {
        Object value = claims.raw();
        for (String segment : claimPath) {
            if (!(value instanceof Map<?, ?> map)) {
                return Set.of();
            }
            value = map.get(segment);
        }

        var roles = new LinkedHashSet<String>();
        if (value instanceof Collection<?> values) {
            for (Object role : values) {
                if (role != null) {
                    roles.add(role.toString());
                }
            }
        } else if (value instanceof String text) {
            for (String role : text.trim().split("\\s+")) {
                if (!role.isEmpty()) {
                    roles.add(role);
                }
            }
        }
        return roles;
    }
}
