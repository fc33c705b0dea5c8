package com.e2eq.cnl.parser;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CnlDocumentParserTest {

    private static final String DOCUMENT = String.join("\n",
            "Notes on Greek philosophy",                 // 1
            "# Socrates [Philosopher]",                  // 2
            "```description",                            // 3
            "Mentor of Plato.",                         // 4
            "```",                                       // 5
            ":::cnl",                                    // 6
            "<teaches> Plato",                           // 7
            "",                                          // 8
            "this is not a statement",                   // 9
            ":::",                                       // 10
            "## young",                                  // 11
            "```cnl",                                    // 12
            "has era: -420 *year*",                      // 13
            "```",                                       // 14
            "# *some* **ancient** Athens [City]",        // 15
            "A city in Attica.");                        // 16

    private final CnlDocumentParser parser = new CnlDocumentParser();

    @Test
    void testBlocksAndPreamble() {
        CnlDocument doc = parser.parse(DOCUMENT);
        assertEquals(List.of("Notes on Greek philosophy"), doc.preamble());
        assertEquals(2, doc.blocks().size());

        NodeBlock socrates = doc.blocks().get(0);
        assertEquals(2, socrates.headerLine());
        assertEquals("Socrates", socrates.heading().baseName());
        assertEquals(Optional.of("Philosopher"), socrates.heading().nodeType());
        assertEquals("socrates", socrates.heading().nodeId());
        assertEquals(Optional.of("Mentor of Plato."), socrates.description());

        NodeBlock athens = doc.blocks().get(1);
        assertEquals(15, athens.headerLine());
        assertEquals("Athens", athens.heading().baseName());
        assertEquals(Optional.of("ancient"), athens.heading().qualifier());
        assertEquals(Optional.of("some"), athens.heading().quantifier());
        assertEquals("ancient_athens", athens.heading().nodeId());
        assertTrue(athens.notationSegments().isEmpty());
        assertTrue(athens.segments().get(0) instanceof ProseSegment);
    }

    @Test
    void testNotationSegmentsFollowMorphHeadings() {
        NodeBlock socrates = parser.parse(DOCUMENT).blocks().get(0);
        List<NotationSegment> segments = socrates.notationSegments();
        assertEquals(2, segments.size());

        NotationSegment basic = segments.get(0);
        assertEquals(Optional.empty(), basic.morphName());
        assertEquals(Fence.COLONS, basic.fence());
        assertEquals(6, basic.openLine());
        assertEquals(2, basic.lines().size());
        assertEquals(7, basic.lines().get(0).lineNumber());
        assertEquals(9, basic.lines().get(1).lineNumber());

        NotationSegment young = segments.get(1);
        assertEquals(Optional.of("young"), young.morphName());
        assertEquals(Fence.BACKTICKS, young.fence());
        assertEquals(13, young.lines().get(0).lineNumber());
    }

    @Test
    void testMalformedLineDoesNotStopTheDocument() {
        CnlDocument doc = parser.parse(DOCUMENT);
        assertEquals(2, doc.statementCount());
        assertEquals(1, doc.parseErrors().size());
        ParseError error = doc.parseErrors().get(0);
        assertEquals(9, error.line());
        assertEquals("this is not a statement", error.rawText());
    }

    @Test
    void testUnterminatedFenceEndsWithTheDocument() {
        CnlDocument doc = parser.parse("# A\n:::cnl\n<knows> B");
        assertEquals(1, doc.blocks().size());
        assertEquals(1, doc.blocks().get(0).notationSegments().size());
        assertEquals(1, doc.blocks().get(0).notationSegments().get(0).lines().size());
        assertEquals(1, doc.statementCount());
    }

    @Test
    void testHeadingInsideFenceIsAStatementLine() {
        CnlDocument doc = parser.parse("# A\n:::cnl\n# B\n:::");
        assertEquals(1, doc.blocks().size());
        assertEquals(1, doc.parseErrors().size());
    }

    @Test
    void testEmptyDocument() {
        CnlDocument doc = parser.parse("");
        assertTrue(doc.blocks().isEmpty());
        assertEquals(0, doc.statementCount());
    }

    @Test
    void testCanonicalRenderingKeepsProseAndFailedLines() {
        String text = "# Socrates\nA philosopher.\n:::cnl\n<teaches>    Plato\nnot a statement\n:::";
        String rendered = new CnlRenderer().render(parser.parse(text));
        assertEquals("# Socrates\nA philosopher.\n:::cnl\n<teaches> Plato\nnot a statement\n:::", rendered);
    }

    @Test
    void testHeadingRendering() {
        NodeHeading heading = NodeHeading.parse("*all*   **ancient**  Philosophers [Person]");
        assertEquals("# *all* **ancient** Philosophers [Person]", heading.render());
        assertEquals("ancient_philosophers", heading.nodeId());
    }
}
