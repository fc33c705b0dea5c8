package com.e2eq.cnl.parser;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Optional;

/**
 * One parsed notation line: either a relation or an attribute.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = RelationStatement.class, name = "relation"),
        @JsonSubTypes.Type(value = AttributeStatement.class, name = "attribute")
})
public interface Statement {

    /** Relation or attribute type name. */
    String name();

    Optional<String> adverb();

    Optional<String> modality();
}
