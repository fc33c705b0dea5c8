package com.e2eq.cnl.schema;

import com.e2eq.cnl.schema.SchemaRegistry.*;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Loads a tier of type definitions from a YAML file or classpath resource.
 * The YAML lists nodeTypes, relationTypes and attributeTypes.
 */
public final class YamlSchemaLoader {

    // DTOs mirroring YAML
    public record YSchema(Integer version, List<YNodeType> nodeTypes, List<YRelationType> relationTypes,
                          List<YAttributeType> attributeTypes) {}
    public record YNodeType(String name, String description, List<String> parentTypes) {}
    public record YRelationType(
            String name,
            String description,
            List<String> domain,
            List<String> range,
            Boolean symmetric,
            Boolean transitive,
            String inverseName
    ) {}
    public record YAttributeType(String name, String description, String dataType, String unit,
                                 List<String> allowedValues) {}

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public SchemaDefs loadFromClasspath(String resourcePath) throws IOException {
        String path = resourcePath.startsWith("/") ? resourcePath.substring(1) : resourcePath;
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) cl = YamlSchemaLoader.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(path)) {
            if (in == null) throw new IOException("Resource not found: " + resourcePath);
            return load(in);
        }
    }

    public SchemaDefs loadFromPath(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        }
    }

    public SchemaDefs load(InputStream in) throws IOException {
        return toDefs(mapper.readValue(in, YSchema.class));
    }

    private SchemaDefs toDefs(YSchema y) {
        Map<String, NodeTypeDef> nodeTypes = new LinkedHashMap<>();
        for (YNodeType t : Optional.ofNullable(y.nodeTypes()).orElse(List.of())) {
            nodeTypes.put(t.name(), new NodeTypeDef(t.name(), t.description(), t.parentTypes()));
        }

        Map<String, RelationTypeDef> relationTypes = new LinkedHashMap<>();
        for (YRelationType r : Optional.ofNullable(y.relationTypes()).orElse(List.of())) {
            relationTypes.put(r.name(), new RelationTypeDef(
                    r.name(),
                    r.description(),
                    r.domain(),
                    r.range(),
                    Boolean.TRUE.equals(r.symmetric()),
                    Boolean.TRUE.equals(r.transitive()),
                    Optional.ofNullable(r.inverseName())
            ));
        }

        Map<String, AttributeTypeDef> attributeTypes = new LinkedHashMap<>();
        for (YAttributeType a : Optional.ofNullable(y.attributeTypes()).orElse(List.of())) {
            attributeTypes.put(a.name(), new AttributeTypeDef(
                    a.name(),
                    a.description(),
                    DataType.fromString(a.dataType()),
                    Optional.ofNullable(a.unit()),
                    a.allowedValues()
            ));
        }

        SchemaDefs defs = new SchemaDefs(nodeTypes, relationTypes, attributeTypes);
        SchemaDefinitionValidator.validate(defs);
        return defs;
    }
}
