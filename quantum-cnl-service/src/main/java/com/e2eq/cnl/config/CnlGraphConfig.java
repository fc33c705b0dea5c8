package com.e2eq.cnl.config;

import com.e2eq.cnl.schema.TypeDeletionPolicy;
import com.e2eq.cnl.transition.TransitionCyclePolicy;
import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Maps the {@code cnl-graph.*} properties.
 */
@StaticInitSafe
@ConfigMapping(prefix = "cnl-graph")
public interface CnlGraphConfig {

    /**
     * Classpath location of the global (read-only) schema tier.
     * @return the resource path
     */
    @WithDefault("schema/global-schema.yaml")
    String globalSchema();

    /**
     * Whether deleting a user type still in use is refused or cascades.
     * @return the policy
     */
    @WithDefault("REJECT")
    TypeDeletionPolicy typeDeletionPolicy();

    @WithDefault("ALLOW")
    TransitionCyclePolicy transitionCyclePolicy();

    /**
     * Also write the inverse edge of relations whose type declares one.
     * @return the flag
     */
    @WithDefault("false")
    boolean materializeInverses();

    Scoring scoring();

    interface Scoring {
        @WithDefault("1")
        int node();

        @WithDefault("2")
        int relation();

        @WithDefault("3")
        int attribute();

        @WithDefault("4")
        int attributeWithUnit();

        @WithDefault("2")
        int relationWithQualifier();

        @WithDefault("2")
        int attributeWithQualifier();

        @WithDefault("5")
        int quantified();

        @WithDefault("5")
        int modality();

        @WithDefault("10")
        int transitionNode();

        @WithDefault("10")
        int functionNode();

        @WithDefault("5")
        int polyNodeMorph();

        @WithDefault("10")
        int crossGraphReuse();
    }
}
