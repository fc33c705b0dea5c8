package com.e2eq.cnl.workspace;

import com.e2eq.cnl.compose.ScoreRubric;
import com.e2eq.cnl.schema.TypeDeletionPolicy;
import com.e2eq.cnl.transition.TransitionCyclePolicy;

/**
 * Behaviour switches shared by every graph of a workspace.
 */
public record CnlGraphSettings(String globalSchemaResource,
                               TypeDeletionPolicy typeDeletionPolicy,
                               TransitionCyclePolicy transitionCyclePolicy,
                               boolean materializeInverses,
                               ScoreRubric scoreRubric) {

    public static final String DEFAULT_GLOBAL_SCHEMA = "schema/global-schema.yaml";

    public CnlGraphSettings {
        globalSchemaResource = globalSchemaResource == null || globalSchemaResource.isBlank()
                ? DEFAULT_GLOBAL_SCHEMA : globalSchemaResource;
        typeDeletionPolicy = typeDeletionPolicy == null ? TypeDeletionPolicy.REJECT : typeDeletionPolicy;
        transitionCyclePolicy = transitionCyclePolicy == null ? TransitionCyclePolicy.ALLOW : transitionCyclePolicy;
        scoreRubric = scoreRubric == null ? ScoreRubric.defaults() : scoreRubric;
    }

    public static CnlGraphSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String globalSchemaResource = DEFAULT_GLOBAL_SCHEMA;
        private TypeDeletionPolicy typeDeletionPolicy = TypeDeletionPolicy.REJECT;
        private TransitionCyclePolicy transitionCyclePolicy = TransitionCyclePolicy.ALLOW;
        private boolean materializeInverses;
        private ScoreRubric scoreRubric = ScoreRubric.defaults();

        private Builder() {}

        public Builder globalSchemaResource(String resource) {
            this.globalSchemaResource = resource;
            return this;
        }

        public Builder typeDeletionPolicy(TypeDeletionPolicy policy) {
            this.typeDeletionPolicy = policy;
            return this;
        }

        public Builder transitionCyclePolicy(TransitionCyclePolicy policy) {
            this.transitionCyclePolicy = policy;
            return this;
        }

        public Builder materializeInverses(boolean materialize) {
            this.materializeInverses = materialize;
            return this;
        }

        public Builder scoreRubric(ScoreRubric rubric) {
            this.scoreRubric = rubric;
            return this;
        }

        public CnlGraphSettings build() {
            return new CnlGraphSettings(globalSchemaResource, typeDeletionPolicy, transitionCyclePolicy,
                    materializeInverses, scoreRubric);
        }
    }
}
