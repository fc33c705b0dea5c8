package com.e2eq.cnl.parser;

import com.e2eq.cnl.graph.GraphIds;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsed {@code # [*quantifier*] [**qualifier**] Name [[NodeType]]} heading of a node block.
 */
public record NodeHeading(String baseName,
                          Optional<String> qualifier,
                          Optional<String> quantifier,
                          Optional<String> nodeType) {

    private static final Pattern HEADING = Pattern.compile(
            "^(?:\\*([^*]+)\\*\\s*)?(?:\\*\\*([^*]+)\\*\\*\\s*)?(.*?)\\s*(?:\\[([^\\]]+)\\])?$");

    public NodeHeading {
        baseName = GraphIds.tidy(baseName);
        qualifier = RelationStatement.clean(qualifier);
        quantifier = RelationStatement.clean(quantifier);
        nodeType = RelationStatement.clean(nodeType);
    }

    /** Parses the heading text that follows the leading {@code #}. */
    public static NodeHeading parse(String text) {
        String t = text == null ? "" : text.trim();
        Matcher m = HEADING.matcher(t);
        if (!m.matches() || m.group(3).isBlank()) {
            return new NodeHeading(t, Optional.empty(), Optional.empty(), Optional.empty());
        }
        return new NodeHeading(m.group(3),
                Optional.ofNullable(m.group(2)),
                Optional.ofNullable(m.group(1)),
                Optional.ofNullable(m.group(4)));
    }

    public String nodeId() {
        return GraphIds.nodeId(baseName, qualifier.orElse(null));
    }

    public String render() {
        StringBuilder sb = new StringBuilder("#");
        quantifier.ifPresent(q -> sb.append(" *").append(q).append('*'));
        qualifier.ifPresent(q -> sb.append(" **").append(q).append("**"));
        sb.append(' ').append(baseName);
        nodeType.ifPresent(t -> sb.append(" [").append(t).append(']'));
        return sb.toString();
    }
}
