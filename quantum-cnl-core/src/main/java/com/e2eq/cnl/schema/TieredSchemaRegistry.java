package com.e2eq.cnl.schema;

import com.e2eq.cnl.exceptions.DuplicateException;
import com.e2eq.cnl.exceptions.ReferentialException;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Two-tier schema registry: a read-only global tier shared by every graph and an editable
 * user tier owned by one graph. Lookups consult the global tier first. A name may exist in
 * only one of the two tiers.
 */
public final class TieredSchemaRegistry implements SchemaRegistry {
    private static final Logger LOG = Logger.getLogger(TieredSchemaRegistry.class.getName());

    private final SchemaRegistry global;
    private final Map<String, NodeTypeDef> userNodeTypes = new LinkedHashMap<>();
    private final Map<String, RelationTypeDef> userRelationTypes = new LinkedHashMap<>();
    private final Map<String, AttributeTypeDef> userAttributeTypes = new LinkedHashMap<>();

    public TieredSchemaRegistry(SchemaRegistry global) {
        this.global = Objects.requireNonNull(global, "global");
    }

    public TieredSchemaRegistry(SchemaRegistry global, SchemaDefs userTier) {
        this(global);
        if (userTier != null) {
            synchronized (this) {
                for (String name : userTier.nodeTypes().keySet()) {
                    if (global.nodeType(name).isPresent()) throw new DuplicateException(name, SchemaTier.GLOBAL.jsonName());
                }
                for (String name : userTier.relationTypes().keySet()) {
                    if (global.relationType(name).isPresent()) throw new DuplicateException(name, SchemaTier.GLOBAL.jsonName());
                }
                for (String name : userTier.attributeTypes().keySet()) {
                    if (global.attributeType(name).isPresent()) throw new DuplicateException(name, SchemaTier.GLOBAL.jsonName());
                }
                userNodeTypes.putAll(userTier.nodeTypes());
                userRelationTypes.putAll(userTier.relationTypes());
                userAttributeTypes.putAll(userTier.attributeTypes());
                SchemaDefinitionValidator.validate(getCurrentDefs());
            }
        }
    }

    public SchemaRegistry global() {
        return global;
    }

    @Override
    public synchronized Optional<NodeTypeDef> nodeType(String name) {
        return global.nodeType(name).or(() -> Optional.ofNullable(userNodeTypes.get(name)));
    }

    @Override
    public synchronized Optional<RelationTypeDef> relationType(String name) {
        return global.relationType(name).or(() -> Optional.ofNullable(userRelationTypes.get(name)));
    }

    @Override
    public synchronized Optional<AttributeTypeDef> attributeType(String name) {
        return global.attributeType(name).or(() -> Optional.ofNullable(userAttributeTypes.get(name)));
    }

    @Override
    public synchronized Map<String, NodeTypeDef> nodeTypes() {
        return merged(global.nodeTypes(), userNodeTypes);
    }

    @Override
    public synchronized Map<String, RelationTypeDef> relationTypes() {
        return merged(global.relationTypes(), userRelationTypes);
    }

    @Override
    public synchronized Map<String, AttributeTypeDef> attributeTypes() {
        return merged(global.attributeTypes(), userAttributeTypes);
    }

    @Override
    public synchronized Optional<SchemaTier> tierOf(String name) {
        if (global.tierOf(name).isPresent()) {
            return Optional.of(SchemaTier.GLOBAL);
        }
        if (userNodeTypes.containsKey(name) || userRelationTypes.containsKey(name) || userAttributeTypes.containsKey(name)) {
            return Optional.of(SchemaTier.USER);
        }
        return Optional.empty();
    }

    /** Snapshot of the user tier only. */
    public synchronized SchemaDefs userDefs() {
        return new SchemaDefs(Map.copyOf(userNodeTypes), Map.copyOf(userRelationTypes), Map.copyOf(userAttributeTypes));
    }

    /** Definitions of one tier, in insertion order. */
    public synchronized SchemaDefs defsOf(SchemaTier tier) {
        if (tier == SchemaTier.GLOBAL) {
            return global.getCurrentDefs();
        }
        return new SchemaDefs(new LinkedHashMap<>(userNodeTypes), new LinkedHashMap<>(userRelationTypes),
                new LinkedHashMap<>(userAttributeTypes));
    }

    // ---- user tier writes ----

    public synchronized NodeTypeDef createNodeType(NodeTypeDef def) {
        return create(def.name(), def, global.nodeTypes(), userNodeTypes);
    }

    public synchronized RelationTypeDef createRelationType(RelationTypeDef def) {
        return create(def.name(), def, global.relationTypes(), userRelationTypes);
    }

    public synchronized AttributeTypeDef createAttributeType(AttributeTypeDef def) {
        return create(def.name(), def, global.attributeTypes(), userAttributeTypes);
    }

    public synchronized NodeTypeDef updateNodeType(String name, NodeTypeDef def) {
        return update(name, def, def.name(), userNodeTypes, "Node type");
    }

    public synchronized RelationTypeDef updateRelationType(String name, RelationTypeDef def) {
        return update(name, def, def.name(), userRelationTypes, "Relation type");
    }

    public synchronized AttributeTypeDef updateAttributeType(String name, AttributeTypeDef def) {
        return update(name, def, def.name(), userAttributeTypes, "Attribute type");
    }

    public synchronized NodeTypeDef deleteNodeType(String name) {
        return delete(name, userNodeTypes, "Node type");
    }

    public synchronized RelationTypeDef deleteRelationType(String name) {
        return delete(name, userRelationTypes, "Relation type");
    }

    public synchronized AttributeTypeDef deleteAttributeType(String name) {
        return delete(name, userAttributeTypes, "Attribute type");
    }

    private <T> T create(String name, T def, Map<String, T> globalTier, Map<String, T> userTier) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("A type must have a name");
        }
        if (globalTier.containsKey(name)) {
            throw new DuplicateException(name, SchemaTier.GLOBAL.jsonName());
        }
        if (userTier.containsKey(name)) {
            throw new DuplicateException(name, SchemaTier.USER.jsonName());
        }
        userTier.put(name, def);
        revalidateOrRollback(() -> userTier.remove(name));
        LOG.log(Level.FINE, "Created user type {0}", name);
        return def;
    }

    private <T> T update(String name, T def, String newName, Map<String, T> userTier, String what) {
        T previous = userTier.get(name);
        if (previous == null) {
            throw ReferentialException.notFound(what, name);
        }
        if (!name.equals(newName)) {
            throw new IllegalArgumentException(what + " '" + name + "' cannot be renamed to '" + newName + "'");
        }
        userTier.put(name, def);
        revalidateOrRollback(() -> userTier.put(name, previous));
        LOG.log(Level.FINE, "Updated user type {0}", name);
        return def;
    }

    private <T> T delete(String name, Map<String, T> userTier, String what) {
        T previous = userTier.remove(name);
        if (previous == null) {
            throw ReferentialException.notFound(what, name);
        }
        LOG.log(Level.FINE, "Deleted user type {0}", name);
        return previous;
    }

    private void revalidateOrRollback(Runnable rollback) {
        try {
            SchemaDefinitionValidator.validate(getCurrentDefs());
        } catch (IllegalArgumentException e) {
            rollback.run();
            throw e;
        }
    }

    private static <T> Map<String, T> merged(Map<String, T> globalTier, Map<String, T> userTier) {
        Map<String, T> all = new LinkedHashMap<>(globalTier);
        userTier.forEach(all::putIfAbsent);
        return Collections.unmodifiableMap(all);
    }
}
