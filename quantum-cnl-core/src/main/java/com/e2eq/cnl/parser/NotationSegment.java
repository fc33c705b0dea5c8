package com.e2eq.cnl.parser;

import java.util.List;
import java.util.Optional;

/**
 * A fenced run of statement lines. {@code morphName} is the morph selected by the closest
 * preceding {@link MorphHeading}, empty for the basic morph.
 */
public record NotationSegment(Optional<String> morphName,
                              Fence fence,
                              int openLine,
                              List<ParsedLine> lines) implements BlockSegment {
    public NotationSegment {
        morphName = morphName == null ? Optional.empty() : morphName;
        lines = lines == null ? List.of() : List.copyOf(lines);
    }
}
