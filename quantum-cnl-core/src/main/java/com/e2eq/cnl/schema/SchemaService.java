package com.e2eq.cnl.schema;

import com.e2eq.cnl.exceptions.ReferentialException;
import com.e2eq.cnl.graph.KnowledgeGraph;
import com.e2eq.cnl.graph.Node;
import com.e2eq.cnl.graph.RelationEdge;
import com.e2eq.cnl.graph.AttributeEdge;
import com.e2eq.cnl.schema.SchemaRegistry.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Schema CRUD for one graph. Writes go to the user tier; deletes check what in the graph still
 * uses the type and either refuse or cascade according to the {@link TypeDeletionPolicy}.
 * Types that other user types refer to (as parent, domain or range) are never deleted.
 */
public class SchemaService {
    private static final Logger LOG = Logger.getLogger(SchemaService.class.getName());

    private final TieredSchemaRegistry registry;
    private final KnowledgeGraph graph;
    private final TypeDeletionPolicy deletionPolicy;

    public SchemaService(TieredSchemaRegistry registry, KnowledgeGraph graph, TypeDeletionPolicy deletionPolicy) {
        this.registry = registry;
        this.graph = graph;
        this.deletionPolicy = deletionPolicy == null ? TypeDeletionPolicy.REJECT : deletionPolicy;
    }

    public TieredSchemaRegistry registry() {
        return registry;
    }

    public TypeDeletionPolicy deletionPolicy() {
        return deletionPolicy;
    }

    /** Hash of both tiers, changes whenever a user type changes. */
    public String version() {
        return registry.getHash();
    }

    public List<NodeTypeDef> listNodeTypes(SchemaTier tier) {
        return tier == null ? new ArrayList<>(registry.nodeTypes().values())
                : new ArrayList<>(registry.defsOf(tier).nodeTypes().values());
    }

    public List<RelationTypeDef> listRelationTypes(SchemaTier tier) {
        return tier == null ? new ArrayList<>(registry.relationTypes().values())
                : new ArrayList<>(registry.defsOf(tier).relationTypes().values());
    }

    public List<AttributeTypeDef> listAttributeTypes(SchemaTier tier) {
        return tier == null ? new ArrayList<>(registry.attributeTypes().values())
                : new ArrayList<>(registry.defsOf(tier).attributeTypes().values());
    }

    public NodeTypeDef createNodeType(NodeTypeDef def) {
        return graph.write(() -> registry.createNodeType(def));
    }

    public RelationTypeDef createRelationType(RelationTypeDef def) {
        return graph.write(() -> registry.createRelationType(def));
    }

    public AttributeTypeDef createAttributeType(AttributeTypeDef def) {
        return graph.write(() -> registry.createAttributeType(def));
    }

    public NodeTypeDef updateNodeType(String name, NodeTypeDef def) {
        return graph.write(() -> registry.updateNodeType(name, def));
    }

    public RelationTypeDef updateRelationType(String name, RelationTypeDef def) {
        return graph.write(() -> registry.updateRelationType(name, def));
    }

    public AttributeTypeDef updateAttributeType(String name, AttributeTypeDef def) {
        return graph.write(() -> registry.updateAttributeType(name, def));
    }

    public void deleteNodeType(String name) {
        graph.write(() -> {
            requireUserType(name, registry.userDefs().nodeTypes().containsKey(name), "Node type");
            for (NodeTypeDef t : registry.nodeTypes().values()) {
                if (t.parentTypes().contains(name)) {
                    throw ReferentialException.dangling(name, "Node type '" + name + "' is a parent of '" + t.name() + "'");
                }
            }
            for (RelationTypeDef r : registry.relationTypes().values()) {
                if (r.domain().contains(name) || r.range().contains(name)) {
                    throw ReferentialException.dangling(name,
                            "Node type '" + name + "' is in the domain or range of '" + r.name() + "'");
                }
            }
            List<Node> typed = new ArrayList<>();
            for (Node n : graph.nodes()) {
                if (n.nodeType().equals(Optional.of(name))) typed.add(n);
            }
            if (!typed.isEmpty() && deletionPolicy == TypeDeletionPolicy.REJECT) {
                throw ReferentialException.dangling(name,
                        "Node type '" + name + "' is still used by " + typed.size() + " node(s)");
            }
            for (Node n : typed) {
                graph.putNode(n.withDetails(n.role(), Optional.empty(), n.description(), n.quantifier())
                        .withVersion(n.version() + 1));
            }
            registry.deleteNodeType(name);
            LOG.log(Level.FINE, "Deleted node type {0}, cleared on {1} nodes", new Object[]{name, typed.size()});
            return null;
        });
    }

    public void deleteRelationType(String name) {
        graph.write(() -> {
            requireUserType(name, registry.userDefs().relationTypes().containsKey(name), "Relation type");
            List<RelationEdge> edges = graph.edgeStore().findRelationsByName(name);
            if (!edges.isEmpty() && deletionPolicy == TypeDeletionPolicy.REJECT) {
                throw ReferentialException.dangling(name,
                        "Relation type '" + name + "' is still used by " + edges.size() + " edge(s)");
            }
            edges.forEach(e -> graph.purgeEdge(e.id()));
            registry.deleteRelationType(name);
            LOG.log(Level.FINE, "Deleted relation type {0} and {1} edges", new Object[]{name, edges.size()});
            return null;
        });
    }

    public void deleteAttributeType(String name) {
        graph.write(() -> {
            requireUserType(name, registry.userDefs().attributeTypes().containsKey(name), "Attribute type");
            List<AttributeEdge> edges = graph.edgeStore().findAttributesByName(name);
            if (!edges.isEmpty() && deletionPolicy == TypeDeletionPolicy.REJECT) {
                throw ReferentialException.dangling(name,
                        "Attribute type '" + name + "' is still used by " + edges.size() + " edge(s)");
            }
            edges.forEach(e -> graph.purgeEdge(e.id()));
            registry.deleteAttributeType(name);
            LOG.log(Level.FINE, "Deleted attribute type {0} and {1} edges", new Object[]{name, edges.size()});
            return null;
        });
    }

    private void requireUserType(String name, boolean inUserTier, String what) {
        if (!inUserTier) {
            String where = registry.tierOf(name).map(t -> " in the user tier").orElse("");
            throw ReferentialException.notFound(what + where, name);
        }
    }
}
