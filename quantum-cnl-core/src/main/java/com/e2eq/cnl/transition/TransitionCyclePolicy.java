package com.e2eq.cnl.transition;

/**
 * What to do when a new transition closes a cycle among node states.
 */
public enum TransitionCyclePolicy {
    /** Record the transition anyway. */
    ALLOW,
    /** Refuse the transition with an {@link IllegalArgumentException}. */
    REJECT
}
