package warden.adapter.in.auth;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Requires an allow-listed API key in the configured header
 * ({@code warden.auth.api-key.header}).
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
public @interface RequireApiKey {

    /**
     * Let requests without the header through with no principal. A key that is
     * present is still checked.
     */
    boolean optional() default false;
}
