package com.e2eq.cnl;

import com.e2eq.cnl.schema.SchemaRegistry;
import com.e2eq.cnl.schema.YamlSchemaLoader;
import com.e2eq.cnl.workspace.CnlGraphSettings;
import com.e2eq.cnl.workspace.GraphWorkspaces;

import java.io.IOException;
import java.io.UncheckedIOException;

public final class TestWorkspaces {
    private TestWorkspaces() {}

    public static GraphWorkspaces fresh() {
        try {
            SchemaRegistry global = SchemaRegistry.inMemory(
                    new YamlSchemaLoader().loadFromClasspath(CnlGraphSettings.DEFAULT_GLOBAL_SCHEMA));
            return new GraphWorkspaces(global, CnlGraphSettings.defaults());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
