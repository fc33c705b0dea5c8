package com.e2eq.cnl.graph;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A graph node. Instances are immutable; the knowledge graph replaces them on every change.
 * The first entry of {@code morphIds} is the basic morph.
 */
public record Node(String id,
                   String baseName,
                   Optional<String> qualifier,
                   Optional<String> quantifier,
                   NodeRole role,
                   Optional<String> nodeType,
                   Optional<String> description,
                   List<String> morphIds,
                   String activeMorphId,
                   long version) {

    public Node {
        qualifier = blankToEmpty(qualifier);
        quantifier = blankToEmpty(quantifier);
        nodeType = blankToEmpty(nodeType);
        description = blankToEmpty(description);
        role = role == null ? NodeRole.INDIVIDUAL : role;
        morphIds = morphIds == null ? List.of() : List.copyOf(morphIds);
        if (activeMorphId == null && !morphIds.isEmpty()) {
            activeMorphId = morphIds.get(0);
        }
    }

    @JsonIgnore
    public String basicMorphId() {
        return morphIds.get(0);
    }

    /** Base name prefixed by the qualifier, the way a heading shows it. */
    @JsonIgnore
    public String displayName() {
        return qualifier.map(q -> q + " " + baseName).orElse(baseName);
    }

    public Node withMorphAdded(String morphId) {
        List<String> ids = new ArrayList<>(morphIds);
        ids.add(morphId);
        return new Node(id, baseName, qualifier, quantifier, role, nodeType, description, ids, activeMorphId, version);
    }

    public Node withMorphRemoved(String morphId) {
        List<String> ids = new ArrayList<>(morphIds);
        ids.remove(morphId);
        String active = morphId.equals(activeMorphId) ? ids.get(0) : activeMorphId;
        return new Node(id, baseName, qualifier, quantifier, role, nodeType, description, ids, active, version);
    }

    public Node withActiveMorph(String morphId) {
        return new Node(id, baseName, qualifier, quantifier, role, nodeType, description, morphIds, morphId, version);
    }

    public Node withDetails(NodeRole newRole, Optional<String> newNodeType, Optional<String> newDescription,
                            Optional<String> newQuantifier) {
        return new Node(id, baseName, qualifier, newQuantifier, newRole, newNodeType, newDescription, morphIds,
                activeMorphId, version);
    }

    public Node withVersion(long newVersion) {
        return new Node(id, baseName, qualifier, quantifier, role, nodeType, description, morphIds, activeMorphId, newVersion);
    }

    static Optional<String> blankToEmpty(Optional<String> value) {
        return value == null ? Optional.empty() : value.map(String::trim).filter(s -> !s.isEmpty());
    }
}
