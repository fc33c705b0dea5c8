package com.e2eq.cnl.schema;

import java.util.*;

/**
 * Immutable single-tier registry, used for the read-only global schema.
 */
public final class InMemorySchemaRegistry implements SchemaRegistry {
    private final Map<String, NodeTypeDef> nodeTypes;
    private final Map<String, RelationTypeDef> relationTypes;
    private final Map<String, AttributeTypeDef> attributeTypes;
    private final SchemaTier tier;

    public InMemorySchemaRegistry(SchemaDefs defs, SchemaTier tier) {
        this.nodeTypes = Collections.unmodifiableMap(new LinkedHashMap<>(defs.nodeTypes()));
        this.relationTypes = Collections.unmodifiableMap(new LinkedHashMap<>(defs.relationTypes()));
        this.attributeTypes = Collections.unmodifiableMap(new LinkedHashMap<>(defs.attributeTypes()));
        this.tier = tier;
    }

    public Optional<NodeTypeDef> nodeType(String name) { return Optional.ofNullable(nodeTypes.get(name)); }
    public Optional<RelationTypeDef> relationType(String name) { return Optional.ofNullable(relationTypes.get(name)); }
    public Optional<AttributeTypeDef> attributeType(String name) { return Optional.ofNullable(attributeTypes.get(name)); }
    public Map<String, NodeTypeDef> nodeTypes() { return nodeTypes; }
    public Map<String, RelationTypeDef> relationTypes() { return relationTypes; }
    public Map<String, AttributeTypeDef> attributeTypes() { return attributeTypes; }

    public Optional<SchemaTier> tierOf(String name) {
        if (nodeTypes.containsKey(name) || relationTypes.containsKey(name) || attributeTypes.containsKey(name)) {
            return Optional.of(tier);
        }
        return Optional.empty();
    }
}
