package com.e2eq.cnl.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a markdown-like document into node blocks and parses their fenced notation lines.
 * Prose is kept verbatim. A malformed statement line is recorded as a {@link ParseError} on
 * its block and parsing carries on.
 */
public class CnlDocumentParser {
    private static final Logger LOG = Logger.getLogger(CnlDocumentParser.class.getName());

    private static final Pattern NODE_HEADING = Pattern.compile("^#(?!#)\\s+(.+)$");
    private static final Pattern MORPH_HEADING = Pattern.compile("^##(?!#)\\s+(.+)$");

    private final CnlStatementParser statementParser;

    public CnlDocumentParser() {
        this(new CnlStatementParser());
    }

    public CnlDocumentParser(CnlStatementParser statementParser) {
        this.statementParser = statementParser;
    }

    public CnlDocument parse(String text) {
        String[] lines = (text == null ? "" : text).split("\\r?\\n", -1);
        List<String> preamble = new ArrayList<>();
        List<NodeBlock> blocks = new ArrayList<>();

        BlockBuilder block = null;
        for (int i = 0; i < lines.length; i++) {
            int lineNo = i + 1;
            String line = lines[i];
            String trimmed = line.trim();

            if (block != null && block.notationFence != null) {
                if (trimmed.equals(block.notationFence.close())) {
                    block.closeNotation();
                } else if (!trimmed.isEmpty()) {
                    block.notationLines.add(statementParser.parseLine(lineNo, line));
                }
                continue;
            }
            if (block != null && block.descriptionLines != null) {
                if (trimmed.equals(DescriptionSegment.CLOSE)) {
                    block.closeDescription();
                } else {
                    block.descriptionLines.add(line);
                }
                continue;
            }

            Matcher heading = NODE_HEADING.matcher(line);
            if (heading.matches()) {
                if (block != null) blocks.add(block.build());
                block = new BlockBuilder(lineNo, NodeHeading.parse(heading.group(1)));
                continue;
            }
            if (block == null) {
                preamble.add(line);
                continue;
            }

            Matcher morph = MORPH_HEADING.matcher(line);
            Fence fence = Fence.opening(trimmed);
            if (morph.matches()) {
                block.flushProse();
                String name = morph.group(1).trim();
                block.segments.add(new MorphHeading(lineNo, name));
                block.currentMorph = Optional.of(name);
            } else if (fence != null) {
                block.flushProse();
                block.notationFence = fence;
                block.notationOpenLine = lineNo;
                block.notationLines = new ArrayList<>();
            } else if (trimmed.equalsIgnoreCase(DescriptionSegment.OPEN)) {
                block.flushProse();
                block.descriptionLines = new ArrayList<>();
            } else {
                block.prose.add(line);
            }
        }
        if (block != null) {
            blocks.add(block.build());
        }

        CnlDocument doc = new CnlDocument(preamble, blocks);
        LOG.log(Level.FINE, "Parsed document: {0} blocks, {1} statements, {2} parse errors",
                new Object[]{blocks.size(), doc.statementCount(), doc.parseErrors().size()});
        return doc;
    }

    private static final class BlockBuilder {
        final int headerLine;
        final NodeHeading heading;
        final List<BlockSegment> segments = new ArrayList<>();
        List<String> prose = new ArrayList<>();
        Optional<String> currentMorph = Optional.empty();

        Fence notationFence;
        int notationOpenLine;
        List<ParsedLine> notationLines;
        List<String> descriptionLines;

        BlockBuilder(int headerLine, NodeHeading heading) {
            this.headerLine = headerLine;
            this.heading = heading;
        }

        void flushProse() {
            if (!prose.isEmpty()) {
                segments.add(new ProseSegment(prose));
                prose = new ArrayList<>();
            }
        }

        void closeNotation() {
            segments.add(new NotationSegment(currentMorph, notationFence, notationOpenLine, notationLines));
            notationFence = null;
            notationLines = null;
        }

        void closeDescription() {
            segments.add(new DescriptionSegment(descriptionLines));
            descriptionLines = null;
        }

        // an unterminated fence runs to the end of the block
        NodeBlock build() {
            if (notationFence != null) closeNotation();
            if (descriptionLines != null) closeDescription();
            flushProse();
            return new NodeBlock(headerLine, heading, segments);
        }
    }
}
