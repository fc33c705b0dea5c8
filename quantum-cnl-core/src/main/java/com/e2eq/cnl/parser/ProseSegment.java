package com.e2eq.cnl.parser;

import java.util.List;

/**
 * Free text, kept verbatim and never parsed.
 */
public record ProseSegment(List<String> lines) implements BlockSegment {
    public ProseSegment {
        lines = lines == null ? List.of() : List.copyOf(lines);
    }
}
