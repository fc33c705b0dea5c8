package com.e2eq.cnl.parser;

import com.e2eq.cnl.graph.GraphIds;

import java.util.Optional;

/**
 * {@code has name: [++adverb++] value [*unit*] [[modality]]}
 */
public record AttributeStatement(String name,
                                 Optional<String> adverb,
                                 String value,
                                 Optional<String> unit,
                                 Optional<String> modality) implements Statement {

    public AttributeStatement {
        name = GraphIds.tidy(name);
        adverb = RelationStatement.clean(adverb);
        value = GraphIds.tidy(value);
        unit = RelationStatement.clean(unit);
        modality = RelationStatement.clean(modality);
    }

    public static AttributeStatement of(String name, String value) {
        return new AttributeStatement(name, Optional.empty(), value, Optional.empty(), Optional.empty());
    }
}
