package com.e2eq.cnl.compiler;

import com.e2eq.cnl.parser.ParseError;
import com.e2eq.cnl.validation.ValidationError;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Outcome of applying a document: how many statements made it into the graph, and for every
 * line that did not, why.
 *
 * @param appliedCount     statements written to the graph
 * @param parseErrors      lines that matched no statement form
 * @param validationErrors statements rejected by the schema, per line
 * @param failures         statements whose write was refused by the graph
 * @param touchedNodeIds   nodes named by a heading, in document order
 */
public record ApplyReport(int appliedCount,
                          List<ParseError> parseErrors,
                          List<LineErrors> validationErrors,
                          List<LineFailure> failures,
                          List<String> touchedNodeIds) {

    public ApplyReport {
        parseErrors = parseErrors == null ? List.of() : List.copyOf(parseErrors);
        validationErrors = validationErrors == null ? List.of() : List.copyOf(validationErrors);
        failures = failures == null ? List.of() : List.copyOf(failures);
        touchedNodeIds = touchedNodeIds == null ? List.of() : List.copyOf(touchedNodeIds);
    }

    public record LineErrors(int line, String raw, List<ValidationError> errors) {
    }

    public record LineFailure(int line, String raw, String message) {
    }

    @JsonIgnore
    public boolean isClean() {
        return parseErrors.isEmpty() && validationErrors.isEmpty() && failures.isEmpty();
    }
}
