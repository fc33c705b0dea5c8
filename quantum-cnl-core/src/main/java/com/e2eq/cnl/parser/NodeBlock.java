package com.e2eq.cnl.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A {@code #} heading and everything up to the next one.
 */
public record NodeBlock(int headerLine, NodeHeading heading, List<BlockSegment> segments) {

    public NodeBlock {
        segments = segments == null ? List.of() : List.copyOf(segments);
    }

    public Optional<String> description() {
        for (BlockSegment s : segments) {
            if (s instanceof DescriptionSegment) {
                String text = ((DescriptionSegment) s).text();
                if (!text.isEmpty()) return Optional.of(text);
            }
        }
        return Optional.empty();
    }

    public List<NotationSegment> notationSegments() {
        List<NotationSegment> out = new ArrayList<>();
        for (BlockSegment s : segments) {
            if (s instanceof NotationSegment) out.add((NotationSegment) s);
        }
        return out;
    }

    public List<ParseError> parseErrors() {
        List<ParseError> out = new ArrayList<>();
        for (NotationSegment n : notationSegments()) {
            for (ParsedLine l : n.lines()) {
                l.error().ifPresent(out::add);
            }
        }
        return out;
    }
}
