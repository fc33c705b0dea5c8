package com.e2eq.cnl.transition;

import java.util.List;
import java.util.Optional;

/**
 * A process-like record moving nodes from input states to output states. Transitions are
 * top-level records of a graph and are not owned by any node.
 */
public record Transition(String id,
                         String name,
                         Optional<String> adjective,
                         Tense tense,
                         List<NodeMorphRef> inputs,
                         List<NodeMorphRef> outputs,
                         String description) {

    public Transition {
        adjective = adjective == null ? Optional.empty() : adjective.map(String::trim).filter(s -> !s.isEmpty());
        tense = tense == null ? Tense.PRESENT : tense;
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
        description = description == null ? "" : description;
    }

    public boolean references(String nodeId) {
        return inputs.stream().anyMatch(r -> r.nodeId().equals(nodeId))
                || outputs.stream().anyMatch(r -> r.nodeId().equals(nodeId));
    }

    public boolean referencesMorph(String morphId) {
        return inputs.stream().anyMatch(r -> r.morphId().equals(morphId))
                || outputs.stream().anyMatch(r -> r.morphId().equals(morphId));
    }
}
