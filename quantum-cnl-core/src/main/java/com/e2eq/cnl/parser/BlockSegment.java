package com.e2eq.cnl.parser;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A run of lines inside a node block.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ProseSegment.class, name = "prose"),
        @JsonSubTypes.Type(value = DescriptionSegment.class, name = "description"),
        @JsonSubTypes.Type(value = MorphHeading.class, name = "morph"),
        @JsonSubTypes.Type(value = NotationSegment.class, name = "notation")
})
public interface BlockSegment {
}
