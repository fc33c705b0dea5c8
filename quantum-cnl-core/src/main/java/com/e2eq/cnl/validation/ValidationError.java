package com.e2eq.cnl.validation;

/**
 * Why one statement cannot be applied. {@code field} names the offending part of the
 * statement ({@code name}, {@code domain}, {@code range}, {@code value}) and {@code value}
 * is what the statement said there.
 */
public record ValidationError(ValidationErrorKind kind, String field, String value, String message) {

    static ValidationError of(ValidationErrorKind kind, String field, String value, String message) {
        return new ValidationError(kind, field, value, message);
    }
}
