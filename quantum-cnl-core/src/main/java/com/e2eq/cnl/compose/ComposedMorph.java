package com.e2eq.cnl.compose;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ComposedMorph(String morphId, String name, List<String> relationRefs, List<String> attributeRefs) {
}
