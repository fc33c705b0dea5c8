package com.e2eq.cnl.workspace;

import com.e2eq.cnl.TestSchemas;
import com.e2eq.cnl.exceptions.ReferentialException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GraphWorkspaceTest {

    private final GraphWorkspaces workspaces = new GraphWorkspaces(TestSchemas.global(), CnlGraphSettings.defaults());

    @Test
    void testCrossGraphReuse() {
        GraphWorkspace workspace = workspaces.forUser("u1");
        workspace.graph("biology").saveDocument("# Evolution\n:::cnl\n<part_of> Natural Selection\n:::");
        workspace.graph("history").saveDocument("# Darwin\n:::cnl\n<knows> natural selection\n:::");

        assertEquals(1, workspace.crossGraphReuse("history"));
        assertEquals(1, workspace.crossGraphReuse("biology"));
        assertEquals(List.of("biology", "history"), workspace.graphIds());
    }

    @Test
    void testGraphsAreScopedPerUser() {
        workspaces.forUser("u1").graph("g").nodes().resolveOrCreate("Socrates");
        assertTrue(workspaces.forUser("u2").graph("g").graph().nodes().isEmpty());
        assertSame(workspaces.forUser("u1"), workspaces.forUser("u1"));
    }

    @Test
    void testDeleteAndRequire() {
        GraphWorkspace workspace = workspaces.forUser("u1");
        workspace.graph("g");
        workspace.delete("g");
        assertThrows(ReferentialException.class, () -> workspace.require("g"));
        assertThrows(ReferentialException.class, () -> workspace.delete("g"));
    }

    @Test
    void testRequireCreatesNothing() {
        assertThrows(ReferentialException.class, () -> workspaces.require("u1", "g"));
        assertTrue(workspaces.find("u1").isEmpty());

        GraphContext opened = workspaces.open("u1", "g");
        assertSame(opened, workspaces.require("u1", "g"));
        assertThrows(ReferentialException.class, () -> workspaces.require("u1", "other"));
        assertThrows(ReferentialException.class, () -> workspaces.requireWorkspace("u2", "g"));
        assertEquals(List.of("g"), workspaces.forUser("u1").graphIds());
        assertTrue(workspaces.find("u2").isEmpty());
    }
}
