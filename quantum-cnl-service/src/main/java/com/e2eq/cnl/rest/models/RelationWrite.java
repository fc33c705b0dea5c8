package com.e2eq.cnl.rest.models;

import com.e2eq.cnl.parser.RelationStatement;

import java.util.Optional;

/**
 * Body of a direct relation upsert. {@code morphId} defaults to the source's basic morph.
 */
public record RelationWrite(String sourceId,
                            String morphId,
                            String name,
                            String target,
                            String quantifier,
                            String qualifier,
                            String adverb,
                            String modality) {

    public RelationStatement toStatement() {
        return new RelationStatement(Optional.ofNullable(adverb), name, Optional.ofNullable(quantifier),
                Optional.ofNullable(qualifier), target, Optional.ofNullable(modality));
    }
}
