package com.e2eq.cnl.rest.resources;

import com.e2eq.cnl.TestWorkspaces;
import com.e2eq.cnl.compiler.ApplyReport;
import com.e2eq.cnl.exceptions.ReferentialErrorKind;
import com.e2eq.cnl.exceptions.ReferentialException;
import com.e2eq.cnl.parser.CnlDocument;
import com.e2eq.cnl.workspace.GraphWorkspaces;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DocumentResourceTest {

    private static final String DOCUMENT = String.join("\n",
            "Notes on the ancients",
            "# Socrates [Philosopher]",
            ":::cnl",
            "<knows>    Plato [probably]",
            "<lives_in> Athens",
            "has era: -470 *year*",
            "this is not a statement",
            ":::");

    private GraphWorkspaces workspaces;
    private DocumentResource resource;

    @BeforeEach
    void setUp() {
        workspaces = TestWorkspaces.fresh();
        resource = new DocumentResource(workspaces);
    }

    @Test
    void testSaveAndLoad() {
        ApplyReport report = resource.save("u1", "g1", DOCUMENT);
        assertEquals(3, report.appliedCount());
        assertEquals(1, report.parseErrors().size());
        assertEquals(7, report.parseErrors().get(0).line());
        assertEquals(DOCUMENT, resource.load("u1", "g1"));
    }

    @Test
    void testDocumentsAreScopedByUserAndGraph() {
        resource.save("u1", "g1", DOCUMENT);
        resource.save("u1", "g2", "");
        assertEquals("", resource.load("u1", "g2"));
        assertNotFound(() -> resource.load("u2", "g1"));
    }

    @Test
    void testReadsDoNotCreateGraphs() {
        assertNotFound(() -> resource.load("u1", "g1"));
        assertNotFound(() -> resource.rendered("u1", "g1"));
        assertNotFound(() -> resource.canonical("u1", "g1"));
        assertTrue(workspaces.find("u1").isEmpty());

        resource.save("u1", "g1", DOCUMENT);
        assertNotFound(() -> resource.load("u1", "g3"));
        assertEquals(List.of("g1"), workspaces.forUser("u1").graphIds());
    }

    @Test
    void testParseDoesNotApply() {
        CnlDocument document = resource.parse("u1", "g1", DOCUMENT);
        assertEquals(1, document.blocks().size());
        assertEquals(1, document.parseErrors().size());
        assertTrue(workspaces.find("u1").isEmpty());
    }

    private static void assertNotFound(Executable call) {
        ReferentialException ex = assertThrows(ReferentialException.class, call);
        assertEquals(ReferentialErrorKind.NOT_FOUND, ex.getKind());
    }

    @Test
    void testRenderedAndCanonical() {
        resource.save("u1", "g1", DOCUMENT);
        String rendered = resource.rendered("u1", "g1");
        assertTrue(rendered.contains("<knows> Plato [probably]"));
        assertTrue(rendered.contains("has era: -470 *year*"));
        String canonical = resource.canonical("u1", "g1");
        assertTrue(canonical.startsWith("Notes on the ancients\n"));
        assertTrue(canonical.contains("<lives_in> Athens"));
    }
}
