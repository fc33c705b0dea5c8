package com.e2eq.cnl.schema;

import java.util.*;

/**
 * Read access to node, relation and attribute type definitions.
 */
public interface SchemaRegistry {
    Optional<NodeTypeDef> nodeType(String name);
    Optional<RelationTypeDef> relationType(String name);
    Optional<AttributeTypeDef> attributeType(String name);
    Map<String, NodeTypeDef> nodeTypes();
    Map<String, RelationTypeDef> relationTypes();
    Map<String, AttributeTypeDef> attributeTypes();

    /** Tier a type of any kind is defined in, empty when unknown. */
    Optional<SchemaTier> tierOf(String name);

    default SchemaDefs getCurrentDefs() { return new SchemaDefs(nodeTypes(), relationTypes(), attributeTypes()); }
    default String getHash() { return SchemaHasher.computeHash(getCurrentDefs()); }

    // Closures over the node-type hierarchy
    default Set<String> ancestorsOf(String nodeTypeName) {
        return SchemaClosures.computeAncestors(nodeTypeName, this);
    }
    default Set<String> descendantsOf(String nodeTypeName) {
        return SchemaClosures.computeDescendants(nodeTypeName, this);
    }
    default boolean isSubtypeOf(String nodeTypeName, String candidateAncestor) {
        return nodeTypeName.equals(candidateAncestor) || ancestorsOf(nodeTypeName).contains(candidateAncestor);
    }
    default Optional<String> inverseOf(String relationName) {
        return SchemaClosures.computeInverse(relationName, this);
    }

    static SchemaRegistry inMemory(SchemaDefs defs) { return new InMemorySchemaRegistry(defs, SchemaTier.GLOBAL); }

    record NodeTypeDef(String name, String description, List<String> parentTypes) {
        public NodeTypeDef {
            parentTypes = parentTypes == null ? List.of() : List.copyOf(parentTypes);
        }
    }

    record RelationTypeDef(String name,
                           String description,
                           List<String> domain,
                           List<String> range,
                           boolean symmetric,
                           boolean transitive,
                           Optional<String> inverseName) {
        public RelationTypeDef {
            domain = domain == null ? List.of() : List.copyOf(domain);
            range = range == null ? List.of() : List.copyOf(range);
            inverseName = inverseName == null ? Optional.empty() : inverseName.filter(s -> !s.isBlank());
        }

        public RelationTypeDef(String name, String description, List<String> domain, List<String> range) {
            this(name, description, domain, range, false, false, Optional.empty());
        }
    }

    record AttributeTypeDef(String name,
                            String description,
                            DataType dataType,
                            Optional<String> unit,
                            List<String> allowedValues) {
        public AttributeTypeDef {
            dataType = dataType == null ? DataType.STRING : dataType;
            unit = unit == null ? Optional.empty() : unit.filter(s -> !s.isBlank());
            allowedValues = allowedValues == null ? List.of() : List.copyOf(allowedValues);
        }

        public AttributeTypeDef(String name, String description, DataType dataType) {
            this(name, description, dataType, Optional.empty(), List.of());
        }
    }

    record SchemaDefs(Map<String, NodeTypeDef> nodeTypes,
                      Map<String, RelationTypeDef> relationTypes,
                      Map<String, AttributeTypeDef> attributeTypes) {
        public static SchemaDefs empty() {
            return new SchemaDefs(Map.of(), Map.of(), Map.of());
        }
    }
}
