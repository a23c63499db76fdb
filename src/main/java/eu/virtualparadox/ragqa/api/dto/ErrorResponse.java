package eu.virtualparadox.ragqa.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import eu.virtualparadox.ragqa.error.EErrorKind;

/**
 * @param error human readable message
 * @param kind  failure classification
 * @param field offending input field, validation failures only
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String error, EErrorKind kind, String field) {

    public static ErrorResponse of(final String error, final EErrorKind kind) {
        return new ErrorResponse(error, kind, null);
    }
}
