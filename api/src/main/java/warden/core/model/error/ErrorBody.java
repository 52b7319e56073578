package warden.core.model.error;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Serialized error body. Fields that the active verbosity excludes are null and
 * left out of the JSON.
 *
 * @param kind    wire name of the error kind
 * @param message fixed summary message of the kind
 * @param detail  underlying reason, only at FULL verbosity
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorBody(String kind, String message, String detail) {

    public static ErrorBody message(String message) {
        return new ErrorBody(null, message, null);
    }
}
