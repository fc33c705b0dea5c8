package com.e2eq.cnl.parser;

import java.util.List;

/**
 * Content of a {@code ```description} fence. Becomes the node description on apply.
 */
public record DescriptionSegment(List<String> lines) implements BlockSegment {
    public static final String OPEN = "```description";
    public static final String CLOSE = "```";

    public DescriptionSegment {
        lines = lines == null ? List.of() : List.copyOf(lines);
    }

    public String text() {
        return String.join("\n", lines).trim();
    }
}
