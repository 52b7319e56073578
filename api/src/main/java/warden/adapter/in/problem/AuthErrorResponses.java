package warden.adapter.in.problem;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import warden.core.model.error.ErrorResponse;

/**
 * Converts rendered auth errors to JAX-RS responses.
 */
public final class AuthErrorResponses {

    private AuthErrorResponses() {}

    public static Response toResponse(ErrorResponse rendered) {
        var builder = Response.status(rendered.statusCode());
        rendered.headers().forEach(builder::header);
        rendered.body().ifPresent(body -> builder.type(MediaType.APPLICATION_JSON).entity(body));
        return builder.build();
    }
}
