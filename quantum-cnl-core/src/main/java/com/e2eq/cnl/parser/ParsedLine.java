package com.e2eq.cnl.parser;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Optional;

/**
 * Outcome of parsing one notation line: exactly one of {@code statement} and {@code error}
 * is present.
 */
public record ParsedLine(int lineNumber, String raw, Optional<Statement> statement, Optional<ParseError> error) {

    public ParsedLine {
        statement = statement == null ? Optional.empty() : statement;
        error = error == null ? Optional.empty() : error;
    }

    public static ParsedLine ok(int lineNumber, String raw, Statement statement) {
        return new ParsedLine(lineNumber, raw, Optional.of(statement), Optional.empty());
    }

    public static ParsedLine failed(int lineNumber, String raw, String reason) {
        return new ParsedLine(lineNumber, raw, Optional.empty(), Optional.of(new ParseError(lineNumber, raw, reason)));
    }

    @JsonIgnore
    public boolean isOk() {
        return statement.isPresent();
    }
}
