package com.e2eq.cnl.parser;

/**
 * A notation line that matched neither statement form. {@code line} is the 1-based line
 * number in the document.
 */
public record ParseError(int line, String rawText, String reason) {
}
