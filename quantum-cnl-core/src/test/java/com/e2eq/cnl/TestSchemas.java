package com.e2eq.cnl;

import com.e2eq.cnl.schema.SchemaRegistry;
import com.e2eq.cnl.schema.YamlSchemaLoader;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Global schema shared by tests, loaded from the bundled YAML.
 */
public final class TestSchemas {
    private TestSchemas() {}

    public static SchemaRegistry global() {
        try {
            return SchemaRegistry.inMemory(new YamlSchemaLoader().loadFromClasspath("schema/global-schema.yaml"));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
