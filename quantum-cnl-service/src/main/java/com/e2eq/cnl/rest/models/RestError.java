package com.e2eq.cnl.rest.models;

import com.e2eq.cnl.validation.ValidationError;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.util.List;

@Data
@EqualsAndHashCode
@SuperBuilder
@NoArgsConstructor
@RegisterForReflection
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RestError {
   protected int status;
   protected String reasonCode;
   protected String statusMessage;
   protected String reasonMessage;
   protected String referenceId;
   protected String debugMessage;
   protected List<ValidationError> validationErrors;
}
