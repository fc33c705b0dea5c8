package com.e2eq.cnl.parser;

import com.e2eq.cnl.graph.GraphIds;

import java.util.Optional;

/**
 * {@code [++adverb++] <name> [*quantifier*] [**qualifier**] target [[modality]]}
 */
public record RelationStatement(Optional<String> adverb,
                                String name,
                                Optional<String> quantifier,
                                Optional<String> qualifier,
                                String target,
                                Optional<String> modality) implements Statement {

    public RelationStatement {
        adverb = clean(adverb);
        name = GraphIds.tidy(name);
        quantifier = clean(quantifier);
        qualifier = clean(qualifier);
        target = GraphIds.tidy(target);
        modality = clean(modality);
    }

    public static RelationStatement of(String name, String target) {
        return new RelationStatement(Optional.empty(), name, Optional.empty(), Optional.empty(), target, Optional.empty());
    }

    static Optional<String> clean(Optional<String> value) {
        return value == null ? Optional.empty() : value.map(GraphIds::tidy).filter(s -> !s.isEmpty());
    }
}
