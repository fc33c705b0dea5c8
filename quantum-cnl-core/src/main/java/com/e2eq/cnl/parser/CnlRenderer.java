package com.e2eq.cnl.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Canonical text for statements and documents. Parsing the rendering of a well-formed
 * statement gives back an equal statement.
 */
public class CnlRenderer {

    public String render(Statement statement) {
        if (statement instanceof RelationStatement) {
            return render((RelationStatement) statement);
        }
        if (statement instanceof AttributeStatement) {
            return render((AttributeStatement) statement);
        }
        throw new IllegalArgumentException("Unsupported statement type " + statement.getClass().getName());
    }

    public String render(RelationStatement s) {
        List<String> parts = new ArrayList<>();
        s.adverb().ifPresent(a -> parts.add("++" + a + "++"));
        parts.add("<" + s.name() + ">");
        s.quantifier().ifPresent(q -> parts.add("*" + q + "*"));
        s.qualifier().ifPresent(q -> parts.add("**" + q + "**"));
        parts.add(s.target());
        s.modality().ifPresent(m -> parts.add("[" + m + "]"));
        return String.join(" ", parts);
    }

    public String render(AttributeStatement s) {
        List<String> parts = new ArrayList<>();
        parts.add("has " + s.name() + ":");
        s.adverb().ifPresent(a -> parts.add("++" + a + "++"));
        parts.add(s.value());
        s.unit().ifPresent(u -> parts.add("*" + u + "*"));
        s.modality().ifPresent(m -> parts.add("[" + m + "]"));
        return String.join(" ", parts);
    }

    /**
     * Re-emits a document with canonical headings and statement lines. Prose and description
     * fences are copied unchanged; lines that failed to parse are kept as written.
     */
    public String render(CnlDocument document) {
        List<String> out = new ArrayList<>(document.preamble());
        for (NodeBlock block : document.blocks()) {
            out.add(block.heading().render());
            for (BlockSegment segment : block.segments()) {
                renderSegment(segment, out);
            }
        }
        return String.join("\n", out);
    }

    private void renderSegment(BlockSegment segment, List<String> out) {
        if (segment instanceof ProseSegment) {
            out.addAll(((ProseSegment) segment).lines());
        } else if (segment instanceof DescriptionSegment) {
            out.add(DescriptionSegment.OPEN);
            out.addAll(((DescriptionSegment) segment).lines());
            out.add(DescriptionSegment.CLOSE);
        } else if (segment instanceof MorphHeading) {
            out.add("## " + ((MorphHeading) segment).name());
        } else if (segment instanceof NotationSegment) {
            NotationSegment notation = (NotationSegment) segment;
            out.add(notation.fence().open());
            for (ParsedLine line : notation.lines()) {
                out.add(line.statement().map(this::render).orElse(line.raw().trim()));
            }
            out.add(notation.fence().close());
        }
    }
}
