package warden.adapter.in.auth;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import warden.core.model.auth.StandardClaims;

/**
 * Requires a verified {@code Authorization: Bearer} token.
 *
 * <pre>{@code
 * @GET
 * @Path("/orders")
 * @RequireBearerToken(roles = {"orders:read", "admin"})
 * public List<Order> orders(@Context ContainerRequestContext request) {
 *     var principal = RequestPrincipal.require(request);
 *     ...
 * }
 * }</pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
public @interface RequireBearerToken {

    /**
     * Roles of which the token must carry at least one. Empty requires none.
     */
    String[] roles() default {};

    /**
     * Type the verified claims are converted to.
     */
    Class<?> claims() default StandardClaims.class;

    /**
     * Let requests without an Authorization header through with no principal.
     */
    boolean optional() default false;
}
