package com.e2eq.cnl.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * A parsed CNL document: the text before the first heading, then the node blocks in order.
 */
public record CnlDocument(List<String> preamble, List<NodeBlock> blocks) {

    public CnlDocument {
        preamble = preamble == null ? List.of() : List.copyOf(preamble);
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
    }

    public List<ParseError> parseErrors() {
        List<ParseError> out = new ArrayList<>();
        blocks.forEach(b -> out.addAll(b.parseErrors()));
        return out;
    }

    public int statementCount() {
        int count = 0;
        for (NodeBlock b : blocks) {
            for (NotationSegment n : b.notationSegments()) {
                for (ParsedLine l : n.lines()) {
                    if (l.isOk()) count++;
                }
            }
        }
        return count;
    }
}
