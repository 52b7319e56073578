package warden.core.model.error;

import java.util.Map;
import java.util.Optional;

/**
 * Transport-neutral description of an error response.
 *
 * @param statusCode HTTP status code
 * @param headers    response headers (e.g. {@code WWW-Authenticate})
 * @param body       body to serialize, empty when nothing is disclosed
 */
public record ErrorResponse(int statusCode, Map<String, String> headers, Optional<ErrorBody> body) {

    public static final int NO_CONTENT = 204;

    public ErrorResponse {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        if (body == null) {
            body = Optional.empty();
        }
    }

    public static ErrorResponse noContent() {
        return new ErrorResponse(NO_CONTENT, Map.of(), Optional.empty());
    }
}
