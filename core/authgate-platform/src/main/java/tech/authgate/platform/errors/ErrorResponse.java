package tech.authgate.platform.errors;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON error body: {@code {"error": "...", "error_description": "..."}}.
 */
public record ErrorResponse(
    String error,
    @JsonProperty("error_description") String errorDescription
) {
    public static ErrorResponse of(AuthError error) {
        return new ErrorResponse(error.code(), error.defaultDescription());
    }
}
