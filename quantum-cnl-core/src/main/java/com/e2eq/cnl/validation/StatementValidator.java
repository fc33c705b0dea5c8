package com.e2eq.cnl.validation;

import com.e2eq.cnl.graph.*;
import com.e2eq.cnl.parser.AttributeStatement;
import com.e2eq.cnl.parser.RelationStatement;
import com.e2eq.cnl.parser.Statement;
import com.e2eq.cnl.schema.SchemaRegistry;
import com.e2eq.cnl.schema.SchemaRegistry.AttributeTypeDef;
import com.e2eq.cnl.schema.SchemaRegistry.RelationTypeDef;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Checks parsed statements against the schema and grounds them to edges. Pure: it reads the
 * graph to find the type of an existing target node but never creates or changes anything.
 * <p>
 * Domain and range checks are best-effort. An untyped source, an untyped or not yet existing
 * target, and a node type the schema does not know are all accepted.
 * </p>
 */
public class StatementValidator {

    private final SchemaRegistry schema;
    private final KnowledgeGraph graph;

    public StatementValidator(SchemaRegistry schema, KnowledgeGraph graph) {
        this.schema = schema;
        this.graph = graph;
    }

    public ValidationResult validate(Node source, Statement statement) {
        if (statement instanceof RelationStatement) {
            return validateRelation(source, (RelationStatement) statement);
        }
        if (statement instanceof AttributeStatement) {
            return validateAttribute(source, (AttributeStatement) statement);
        }
        throw new IllegalArgumentException("Unsupported statement type " + statement.getClass().getName());
    }

    ValidationResult validateRelation(Node source, RelationStatement s) {
        List<ValidationError> errors = new ArrayList<>();
        String targetId = GraphIds.nodeId(s.target(), s.qualifier().orElse(null));
        String name = GraphIds.relationName(s.name());
        RelationEdge edge = new RelationEdge(null, name, source.id(), targetId, s.adverb(), s.modality(),
                source.quantifier(), s.quantifier(), s.qualifier());

        Optional<RelationTypeDef> def = schema.relationType(name);
        if (def.isEmpty()) {
            errors.add(ValidationError.of(ValidationErrorKind.UNKNOWN_TYPE, "name", s.name(),
                    "Unknown relation type '" + s.name() + "'"));
            return new ValidationResult(errors, Optional.of(edge), Optional.empty());
        }

        Optional<String> sourceType = source.nodeType();
        if (sourceType.isPresent() && !fits(sourceType.get(), def.get().domain())) {
            errors.add(ValidationError.of(ValidationErrorKind.DOMAIN_RANGE_MISMATCH, "domain", sourceType.get(),
                    "Node type '" + sourceType.get() + "' of '" + source.id() + "' is not in the domain "
                            + def.get().domain() + " of '" + name + "'"));
        }

        Optional<String> targetType = graph.node(targetId).flatMap(Node::nodeType);
        if (targetType.isPresent() && !fits(targetType.get(), def.get().range())) {
            errors.add(ValidationError.of(ValidationErrorKind.DOMAIN_RANGE_MISMATCH, "range", targetType.get(),
                    "Node type '" + targetType.get() + "' of '" + targetId + "' is not in the range "
                            + def.get().range() + " of '" + name + "'"));
        }
        return new ValidationResult(errors, Optional.of(edge), Optional.empty());
    }

    ValidationResult validateAttribute(Node owner, AttributeStatement s) {
        List<ValidationError> errors = new ArrayList<>();
        AttributeEdge edge = new AttributeEdge(null, s.name(), owner.id(), s.value(), s.unit(), s.adverb(),
                s.modality(), owner.quantifier());

        Optional<AttributeTypeDef> def = schema.attributeType(s.name());
        if (def.isEmpty()) {
            errors.add(ValidationError.of(ValidationErrorKind.UNKNOWN_TYPE, "name", s.name(),
                    "Unknown attribute type '" + s.name() + "'"));
            return new ValidationResult(errors, Optional.empty(), Optional.of(edge));
        }

        AttributeTypeDef type = def.get();
        if (!type.dataType().accepts(s.value())) {
            errors.add(ValidationError.of(ValidationErrorKind.BAD_DATA_TYPE, "value", s.value(),
                    "Value '" + s.value() + "' of '" + s.name() + "' is not a valid " + type.dataType().jsonName()));
        } else if (!type.allowedValues().isEmpty() && !isAllowed(s.value(), type.allowedValues())) {
            errors.add(ValidationError.of(ValidationErrorKind.DISALLOWED_VALUE, "value", s.value(),
                    "Value '" + s.value() + "' of '" + s.name() + "' is not one of " + type.allowedValues()));
        }
        return new ValidationResult(errors, Optional.empty(), Optional.of(edge));
    }

    // unknown node types and empty constraint lists are accepted
    private boolean fits(String nodeType, List<String> allowed) {
        if (allowed.isEmpty() || schema.nodeType(nodeType).isEmpty()) {
            return true;
        }
        for (String a : allowed) {
            if (schema.isSubtypeOf(nodeType, a)) return true;
        }
        return false;
    }

    private static boolean isAllowed(String value, List<String> allowed) {
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (String a : allowed) {
            if (a.trim().toLowerCase(Locale.ROOT).equals(v)) return true;
        }
        return false;
    }
}
