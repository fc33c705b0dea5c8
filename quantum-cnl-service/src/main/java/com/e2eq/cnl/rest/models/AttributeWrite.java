package com.e2eq.cnl.rest.models;

import com.e2eq.cnl.parser.AttributeStatement;

import java.util.Optional;

/**
 * Body of a direct attribute upsert. {@code morphId} defaults to the owner's basic morph.
 */
public record AttributeWrite(String ownerId,
                             String morphId,
                             String name,
                             String value,
                             String unit,
                             String adverb,
                             String modality) {

    public AttributeStatement toStatement() {
        return new AttributeStatement(name, Optional.ofNullable(adverb), value, Optional.ofNullable(unit),
                Optional.ofNullable(modality));
    }
}
