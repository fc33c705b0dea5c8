package com.e2eq.cnl.parser;

/**
 * {@code ## name} line selecting the morph that following notation segments write to.
 */
public record MorphHeading(int line, String name) implements BlockSegment {
}
