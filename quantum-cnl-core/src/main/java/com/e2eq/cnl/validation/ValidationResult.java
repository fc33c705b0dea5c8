package com.e2eq.cnl.validation;

import com.e2eq.cnl.graph.AttributeEdge;
import com.e2eq.cnl.graph.RelationEdge;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Optional;

/**
 * Errors found for one statement plus the edge it grounds to. The edge is present even when
 * there are errors so that callers can report the id it would have had.
 */
public record ValidationResult(List<ValidationError> errors,
                               Optional<RelationEdge> relationEdge,
                               Optional<AttributeEdge> attributeEdge) {

    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        relationEdge = relationEdge == null ? Optional.empty() : relationEdge;
        attributeEdge = attributeEdge == null ? Optional.empty() : attributeEdge;
    }

    @JsonIgnore
    public boolean isValid() {
        return errors.isEmpty();
    }

    public Optional<String> edgeId() {
        return relationEdge.map(RelationEdge::id).or(() -> attributeEdge.map(AttributeEdge::id));
    }
}
