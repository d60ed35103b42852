package com.b2b.inventory.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Error body returned to clients. {@code field} is set for validation failures only.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    String error,
    String field
) {
    public static ErrorResponse of(String error) {
        return new ErrorResponse(error, null);
    }
}
