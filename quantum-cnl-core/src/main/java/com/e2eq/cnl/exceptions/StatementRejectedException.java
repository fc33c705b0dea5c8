package com.e2eq.cnl.exceptions;

import com.e2eq.cnl.validation.ValidationError;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown by direct relation/attribute writes when the statement fails schema validation.
 * Document compilation never throws this; it reports the same errors per line.
 */
public class StatementRejectedException extends CnlGraphException {
    private static final long serialVersionUID = 1L;

    private final transient List<ValidationError> errors;

    public StatementRejectedException(List<ValidationError> errors) {
        super(errors.stream().map(ValidationError::message).collect(Collectors.joining("; ")));
        this.errors = List.copyOf(errors);
    }

    public List<ValidationError> getErrors() {
        return errors;
    }
}
